/*
 * Where: audit service layer
 * What: writes and reads point-in-time entity backups (jsonb/bytea rows plus copied files)
 * Why: undo of a delete or update needs the state as it was before the action
 */
package com.estatedesk.audit.service;

import com.estatedesk.audit.config.AuditBackupProperties;
import com.estatedesk.audit.model.DataBackup;
import com.estatedesk.audit.model.RelatedEntity;
import com.estatedesk.audit.model.UndoFailureKind;
import com.estatedesk.audit.repository.DataBackupRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.io.ByteStreams;
import com.google.common.io.MoreFiles;
import com.google.common.io.RecursiveDeleteOption;
import com.google.common.net.UrlEscapers;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Stream;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
public class BackupStore {

  private static final Logger logger = LoggerFactory.getLogger(BackupStore.class);

  private final DataBackupRepository backupRepository;
  private final AuditBackupProperties properties;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  /**
   * Persists a snapshot inside a savepoint of the caller's transaction. File copies are best
   * effort: a file that cannot be copied is logged and the data backup is still written.
   *
   * @throws BackupSnapshotException when the payload cannot be serialized or the row cannot be
   *     written; the savepoint is rolled back and the caller's transaction stays usable
   */
  @Transactional(propagation = Propagation.NESTED)
  public DataBackup snapshot(
      UUID auditRecordId,
      String entityType,
      String entityId,
      JsonNode payload,
      List<RelatedEntity> relatedEntities,
      Instant retentionDeadline) {
    if (payload == null || payload.isNull()) {
      throw new IllegalArgumentException("backup payload is required");
    }
    final Instant now = Instant.now(clock);
    final byte[] raw;
    final String relatedJson;
    try {
      raw = objectMapper.writeValueAsBytes(payload);
      relatedJson =
          relatedEntities == null || relatedEntities.isEmpty()
              ? null
              : objectMapper.writeValueAsString(relatedEntities);
    } catch (JsonProcessingException ex) {
      throw new BackupSnapshotException("failed to serialize backup payload", ex);
    }
    final boolean compressed = raw.length > properties.compressionThresholdBytes();
    final byte[] stored = compressed ? gzip(raw) : raw;
    final UUID backupId = UUID.randomUUID();
    final String filesPath = copyFiles(backupId, entityType, entityId, payload);
    final DataBackup backup =
        new DataBackup(
            backupId,
            auditRecordId,
            entityType,
            entityId,
            stored,
            relatedJson,
            filesPath,
            raw.length,
            compressed,
            now,
            retentionDeadline,
            null);
    try {
      backupRepository.insert(backup);
    } catch (DataAccessException ex) {
      purgeFiles(filesPath);
      throw new BackupSnapshotException("failed to store backup for audit record " + auditRecordId, ex);
    }
    logger.debug(
        "backup stored id={} auditRecordId={} entityType={} sizeBytes={} compressed={} files={}",
        backup.id(),
        auditRecordId,
        entityType,
        raw.length,
        compressed,
        filesPath != null);
    return backup;
  }

  @Transactional(readOnly = true)
  public Optional<DataBackup> findByAuditRecordId(UUID auditRecordId) {
    return backupRepository.findByAuditRecordId(auditRecordId);
  }

  @Transactional(readOnly = true)
  public RestoredBackup restore(UUID backupId) {
    final DataBackup backup =
        backupRepository
            .findById(backupId)
            .orElseThrow(
                () ->
                    new BackupRestoreException(
                        UndoFailureKind.BACKUP_MISSING, "backup not found: " + backupId));
    return decode(backup);
  }

  /** Decodes an already loaded backup; expired backups are treated as gone. */
  public RestoredBackup decode(DataBackup backup) {
    if (backup.isExpiredAt(Instant.now(clock))) {
      throw new BackupRestoreException(
          UndoFailureKind.EXPIRED, "backup expired at " + backup.expiresAt() + ": " + backup.id());
    }
    try {
      final byte[] raw = backup.compressed() ? gunzip(backup.payloadBytes()) : backup.payloadBytes();
      final JsonNode payload = objectMapper.readTree(raw);
      final JsonNode related =
          backup.relatedPayloadJson() == null ? null : objectMapper.readTree(backup.relatedPayloadJson());
      return new RestoredBackup(
          backup.id(), backup.entityType(), backup.entityId(), payload, related, backup.filesPath());
    } catch (IOException ex) {
      throw new BackupRestoreException(
          UndoFailureKind.BACKUP_CORRUPT, "backup is unreadable: " + backup.id(), ex);
    }
  }

  /**
   * Copies backed up files back to their original place under the uploads directory.
   *
   * @return the files written, so a caller whose transaction rolls back can remove them again
   */
  public List<Path> restoreFiles(RestoredBackup backup) {
    if (!backup.hasFiles()) {
      return List.of();
    }
    final Path source = Path.of(backup.filesPath());
    if (!Files.isDirectory(source)) {
      throw new BackupRestoreException(
          UndoFailureKind.BACKUP_MISSING, "backup files are gone: " + backup.filesPath());
    }
    final Path uploads = properties.uploadsDirectory().toAbsolutePath().normalize();
    final List<Path> restored = new ArrayList<>();
    try (Stream<Path> files = Files.walk(source)) {
      for (Path file : files.filter(Files::isRegularFile).toList()) {
        final Path destination = uploads.resolve(source.relativize(file).toString()).normalize();
        if (!destination.startsWith(uploads)) {
          logger.warn("backup file skipped on restore backupId={} path={}", backup.backupId(), file);
          continue;
        }
        atomicCopy(file, destination);
        restored.add(destination);
      }
    } catch (IOException | UncheckedIOException ex) {
      discardRestoredFiles(restored);
      throw new BackupRestoreException(
          UndoFailureKind.RESTORE_FAILED, "failed to restore files from " + backup.filesPath(), ex);
    }
    logger.info("backup files restored backupId={} files={}", backup.backupId(), restored.size());
    return restored;
  }

  /** Removes files written by {@link #restoreFiles}; failures are logged. */
  public void discardRestoredFiles(List<Path> restored) {
    for (Path file : restored) {
      try {
        Files.deleteIfExists(file);
      } catch (IOException ex) {
        logger.warn("restored file cleanup failed path={}", file, ex);
      }
    }
  }

  public boolean markConsumed(UUID backupId) {
    return backupRepository.markConsumed(backupId, Instant.now(clock)) == 1;
  }

  /** Removes a backup file directory; failures are logged and reported as false. */
  public boolean purgeFiles(String filesPath) {
    if (filesPath == null || filesPath.isBlank()) {
      return false;
    }
    final Path directory = Path.of(filesPath).toAbsolutePath().normalize();
    if (!directory.startsWith(backupRoot()) || directory.equals(backupRoot())) {
      logger.warn("backup files cleanup refused outside backup root path={}", filesPath);
      return false;
    }
    if (!Files.exists(directory)) {
      return false;
    }
    try {
      MoreFiles.deleteRecursively(directory, RecursiveDeleteOption.ALLOW_INSECURE);
      return true;
    } catch (IOException ex) {
      logger.warn("backup files cleanup failed path={}", filesPath, ex);
      return false;
    }
  }

  // Each backup gets its own directory: <root>/<type>/<id>/<backupId>/<path relative to uploads>.
  private String copyFiles(UUID backupId, String entityType, String entityId, JsonNode payload) {
    if (!properties.carriesFiles(entityType) || entityId == null) {
      return null;
    }
    final Path target = backupDirectory(backupId, entityType, entityId);
    if (target == null) {
      logger.warn(
          "backup files skipped, unusable path segment entityType={} entityId={}", entityType, entityId);
      return null;
    }
    final Path uploads = properties.uploadsDirectory().toAbsolutePath().normalize();
    final List<String> copied = new ArrayList<>();
    for (String field : properties.fileFields()) {
      final JsonNode value = payload.get(field);
      if (value == null || !value.isTextual() || value.asText().isBlank()) {
        continue;
      }
      final Path source = uploads.resolve(value.asText()).normalize();
      if (!source.startsWith(uploads) || !Files.isRegularFile(source)) {
        logger.warn(
            "backup file skipped entityType={} entityId={} field={} path={}",
            entityType,
            entityId,
            field,
            value.asText());
        continue;
      }
      final Path relative = uploads.relativize(source);
      try {
        atomicCopy(source, target.resolve(relative.toString()));
        copied.add(relative.toString());
      } catch (IOException ex) {
        logger.warn(
            "backup file copy failed entityType={} entityId={} path={}", entityType, entityId, source, ex);
      }
    }
    return copied.isEmpty() ? null : target.toString();
  }

  @VisibleForTesting
  Path backupDirectory(UUID backupId, String entityType, String entityId) {
    final Path root = backupRoot();
    final Path target =
        root.resolve(pathSegment(entityType.toLowerCase(Locale.ROOT)))
            .resolve(pathSegment(entityId))
            .resolve(backupId.toString())
            .normalize();
    // "." and ".." survive escaping; normalizing them changes the depth.
    if (!target.startsWith(root) || root.relativize(target).getNameCount() != 3) {
      return null;
    }
    return target;
  }

  private Path backupRoot() {
    return properties.rootDirectory().toAbsolutePath().normalize();
  }

  private static String pathSegment(String value) {
    return UrlEscapers.urlPathSegmentEscaper().escape(value);
  }

  // Readers never observe a partially written file.
  @VisibleForTesting
  static void atomicCopy(Path source, Path destination) throws IOException {
    final Path directory = destination.toAbsolutePath().getParent();
    Files.createDirectories(directory);
    final Path temp = Files.createTempFile(directory, ".backup-", ".tmp");
    try {
      Files.copy(source, temp, StandardCopyOption.REPLACE_EXISTING);
      Files.move(temp, destination, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } finally {
      Files.deleteIfExists(temp);
    }
  }

  private static byte[] gzip(byte[] raw) {
    final ByteArrayOutputStream buffer = new ByteArrayOutputStream(raw.length / 2 + 16);
    try (GZIPOutputStream out = new GZIPOutputStream(buffer)) {
      out.write(raw);
    } catch (IOException ex) {
      throw new BackupSnapshotException("failed to compress backup payload", ex);
    }
    return buffer.toByteArray();
  }

  private static byte[] gunzip(byte[] stored) throws IOException {
    try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(stored))) {
      return ByteStreams.toByteArray(in);
    }
  }
}
