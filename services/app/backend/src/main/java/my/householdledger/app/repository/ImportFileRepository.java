package my.householdledger.app.repository;

import my.householdledger.app.domain.ImportFile;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ImportFileRepository extends JpaRepository<ImportFile, Long> {
	List<ImportFile> findTop20ByOrderByImportedAtDescFileIdDesc();
}
