package com.bbthechange.gallery.service.impl;

import com.bbthechange.gallery.config.ShareProperties;
import com.bbthechange.gallery.dto.ExportJobDTO;
import com.bbthechange.gallery.exception.ExportJobNotFoundException;
import com.bbthechange.gallery.model.ExportJob;
import com.bbthechange.gallery.model.ExportJobStatus;
import com.bbthechange.gallery.repository.ExportJobRepository;
import com.bbthechange.gallery.security.Actor;
import com.bbthechange.gallery.security.OperationKind;
import com.bbthechange.gallery.service.EventLifecycleService;
import com.bbthechange.gallery.service.ExportJobService;
import com.bbthechange.gallery.service.ExportWorker;
import com.bbthechange.gallery.service.PhotoStorage;
import com.bbthechange.gallery.util.GalleryKeyFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

@Service
public class ExportJobServiceImpl implements ExportJobService {

    private static final Logger logger = LoggerFactory.getLogger(ExportJobServiceImpl.class);

    private final ExportJobRepository exportJobRepository;
    private final EventLifecycleService eventLifecycleService;
    private final ExportWorker exportWorker;
    private final PhotoStorage photoStorage;
    private final ShareProperties shareProperties;

    @Autowired
    public ExportJobServiceImpl(ExportJobRepository exportJobRepository, EventLifecycleService eventLifecycleService,
                                ExportWorker exportWorker, PhotoStorage photoStorage, ShareProperties shareProperties) {
        this.exportJobRepository = exportJobRepository;
        this.eventLifecycleService = eventLifecycleService;
        this.exportWorker = exportWorker;
        this.photoStorage = photoStorage;
        this.shareProperties = shareProperties;
    }

    @Override
    public ExportJobDTO submit(Actor actor, String eventId) {
        eventLifecycleService.requireAccessible(actor, eventId, OperationKind.EXPORT_EVENT);

        ExportJob job = exportJobRepository.save(new ExportJob(eventId, actor.moderatorRef()));
        logger.info("Queued export {} for event {} by {}", job.getJobId(), eventId, actor);
        exportWorker.process(eventId, job.getJobId());
        return new ExportJobDTO(job, null);
    }

    @Override
    public ExportJobDTO get(Actor actor, String eventId, String jobId) {
        eventLifecycleService.requireAccessible(actor, eventId, OperationKind.EXPORT_EVENT);
        if (!GalleryKeyFactory.isValidId(jobId)) {
            throw new ExportJobNotFoundException("Export job not found: " + jobId);
        }
        ExportJob job = exportJobRepository.findById(eventId, jobId)
            .orElseThrow(() -> new ExportJobNotFoundException("Export job not found: " + jobId));

        String downloadUrl = null;
        if (job.getStatus() == ExportJobStatus.COMPLETED && job.getArchiveRef() != null) {
            downloadUrl = photoStorage.presignedGetUrl(job.getArchiveRef(), shareProperties.getPhotoUrlTtl());
        }
        return new ExportJobDTO(job, downloadUrl);
    }
}
