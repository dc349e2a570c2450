/*
 * Where: audit application configuration binding
 * What: where entity backups and uploaded files live, and which entity types carry files
 * Why: the backup tree is shared by every worker and differs per environment
 */
package com.estatedesk.audit.config;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "audit.backup")
public record AuditBackupProperties(
    Path rootDirectory,
    Path uploadsDirectory,
    Set<String> fileEntityTypes,
    List<String> fileFields,
    int compressionThresholdBytes) {

  public AuditBackupProperties {
    rootDirectory = rootDirectory == null ? Path.of("backups", "entities") : rootDirectory;
    uploadsDirectory = uploadsDirectory == null ? Path.of("uploads") : uploadsDirectory;
    fileEntityTypes =
        fileEntityTypes == null || fileEntityTypes.isEmpty()
            ? Set.of("photo", "document")
            : fileEntityTypes.stream()
                .map(type -> type.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    fileFields =
        fileFields == null || fileFields.isEmpty()
            ? List.of("filename", "file_path")
            : List.copyOf(fileFields);
    compressionThresholdBytes =
        compressionThresholdBytes <= 0 ? 64 * 1024 : compressionThresholdBytes;
  }

  public boolean carriesFiles(String entityType) {
    return entityType != null && fileEntityTypes.contains(entityType.toLowerCase(Locale.ROOT));
  }
}
