package com.bbthechange.gallery.service;

import com.bbthechange.gallery.config.AsyncConfig;
import com.bbthechange.gallery.exception.ExportJobNotFoundException;
import com.bbthechange.gallery.model.ExportJob;
import com.bbthechange.gallery.model.ExportJobStatus;
import com.bbthechange.gallery.model.Photo;
import com.bbthechange.gallery.model.PhotoStatus;
import com.bbthechange.gallery.repository.EventRepository;
import com.bbthechange.gallery.repository.ExportJobRepository;
import com.bbthechange.gallery.repository.PhotoRepository;
import com.bbthechange.gallery.util.StorageKeys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Packages approved photos into a ZIP archive off the request thread.
 */
@Component
@Slf4j
public class ExportWorker {

    static final String ARCHIVE_CONTENT_TYPE = "application/zip";

    private final ExportJobRepository exportJobRepository;
    private final PhotoRepository photoRepository;
    private final EventRepository eventRepository;
    private final PhotoStorage photoStorage;
    private final NotificationService notificationService;

    @Autowired
    public ExportWorker(ExportJobRepository exportJobRepository, PhotoRepository photoRepository,
                        EventRepository eventRepository, PhotoStorage photoStorage,
                        NotificationService notificationService) {
        this.exportJobRepository = exportJobRepository;
        this.photoRepository = photoRepository;
        this.eventRepository = eventRepository;
        this.photoStorage = photoStorage;
        this.notificationService = notificationService;
    }

    @Async(AsyncConfig.GALLERY_EXECUTOR)
    public void process(String eventId, String jobId) {
        ExportJob job = exportJobRepository.findById(eventId, jobId)
            .orElseThrow(() -> new ExportJobNotFoundException("Export job not found: " + jobId));
        job.setStatus(ExportJobStatus.RUNNING);
        exportJobRepository.save(job);

        Path archive = null;
        try {
            List<Photo> photos = photoRepository.findAllByEvent(eventId, PhotoStatus.APPROVED);
            archive = Files.createTempFile("export-" + jobId, ".zip");
            writeArchive(archive, photos);

            String archiveRef = StorageKeys.exportKey(eventId, jobId);
            photoStorage.putFile(archiveRef, archive, ARCHIVE_CONTENT_TYPE);

            job.setArchiveRef(archiveRef);
            job.setPhotoCount(photos.size());
            job.setStatus(ExportJobStatus.COMPLETED);
            exportJobRepository.save(job);
            log.info("Export {} of event {} completed with {} photos", jobId, eventId, photos.size());

            eventRepository.findById(eventId)
                .ifPresent(event -> notificationService.notifyExportReady(event, job));

        } catch (IOException | RuntimeException e) {
            log.error("Export {} of event {} failed: {}", jobId, eventId, e.getMessage(), e);
            job.setStatus(ExportJobStatus.FAILED);
            job.setFailureReason(e.getMessage());
            exportJobRepository.save(job);
        } finally {
            deleteQuietly(archive);
        }
    }

    void writeArchive(Path archive, List<Photo> photos) throws IOException {
        try (OutputStream out = Files.newOutputStream(archive);
             ZipOutputStream zip = new ZipOutputStream(out)) {
            int index = 1;
            for (Photo photo : photos) {
                zip.putNextEntry(new ZipEntry(entryName(index++, photo)));
                try (InputStream content = photoStorage.open(photo.getStorageRef())) {
                    content.transferTo(zip);
                }
                zip.closeEntry();
            }
        }
    }

    static String entryName(int index, Photo photo) {
        String ref = photo.getStorageRef() == null ? "" : photo.getStorageRef();
        int dot = ref.lastIndexOf('.');
        String extension = dot > ref.lastIndexOf('/') ? ref.substring(dot) : "";
        return String.format("%04d-%s%s", index, photo.getPhotoId(), extension);
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Could not delete temporary archive {}: {}", file, e.getMessage());
        }
    }
}
