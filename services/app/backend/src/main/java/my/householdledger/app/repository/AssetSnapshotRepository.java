package my.householdledger.app.repository;

import my.householdledger.app.domain.AssetSnapshot;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

public interface AssetSnapshotRepository extends JpaRepository<AssetSnapshot, Long> {
	Optional<AssetSnapshot> findByAssetNameAndYearAndMonth(String assetName, Integer year, Integer month);

	List<AssetSnapshot> findByAssetNameOrderByYearAscMonthAsc(String assetName);

	Optional<AssetSnapshot> findFirstByAssetNameOrderByYearDescMonthDesc(String assetName);

	@Query("""
			select s from AssetSnapshot s
			where s.assetName = :assetName
			  and (s.year * 100 + s.month) <= :periodKey
			order by s.year desc, s.month desc
			""")
	List<AssetSnapshot> findAtOrBefore(@Param("assetName") String assetName,
									   @Param("periodKey") int periodKey,
									   Pageable pageable);

	@Query("select distinct s.assetName from AssetSnapshot s order by s.assetName")
	List<String> findAssetNames();

	@Modifying
	@Query("update AssetSnapshot s set s.assetType = :assetType, s.updatedAt = :updatedAt where s.assetName = :assetName")
	int updateAssetType(@Param("assetName") String assetName,
						@Param("assetType") String assetType,
						@Param("updatedAt") LocalDateTime updatedAt);
}
