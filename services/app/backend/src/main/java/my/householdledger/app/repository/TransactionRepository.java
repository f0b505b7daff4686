package my.householdledger.app.repository;

import my.householdledger.app.domain.Transaction;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;

public interface TransactionRepository extends JpaRepository<Transaction, Long> {
	@Modifying
	@Query("delete from Transaction t where t.year = :year and t.month = :month")
	int deleteByPeriod(@Param("year") int year, @Param("month") int month);

	@Modifying
	@Query("delete from Transaction t where t.year = :year and t.month = :month and t.type = :type and t.memo = :memo")
	int deleteByPeriodAndTypeAndMemo(@Param("year") int year,
									 @Param("month") int month,
									 @Param("type") String type,
									 @Param("memo") String memo);

	@Query("""
			select case when count(t) > 0 then true else false end
			from Transaction t
			where t.date = :date
			  and t.assetName = :assetName
			  and t.incomeAmount = :incomeAmount
			  and t.expenseAmount = :expenseAmount
			  and t.category = :category
			  and (t.memo is null or t.memo <> :sentinelMemo)
			""")
	boolean existsMatchingTransfer(@Param("date") LocalDate date,
								   @Param("assetName") String assetName,
								   @Param("incomeAmount") long incomeAmount,
								   @Param("expenseAmount") long expenseAmount,
								   @Param("category") String category,
								   @Param("sentinelMemo") String sentinelMemo);

	@Query("""
			select coalesce(sum(t.incomeAmount), 0)
			from Transaction t
			where t.type = :type
			  and t.assetName = :assetName
			  and (t.year * 100 + t.month) <= :periodKey
			""")
	long sumIncomeUpTo(@Param("type") String type,
					   @Param("assetName") String assetName,
					   @Param("periodKey") int periodKey);
}
