package my.householdledger.app.dto;

import java.time.LocalDateTime;

public record ImportFileDto(Long fileId,
							String source,
							String filename,
							String fileHash,
							int rowCount,
							LocalDateTime importedAt,
							String status) {
}
