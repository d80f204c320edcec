package com.bbthechange.gallery.repository;

import com.bbthechange.gallery.model.ExportJob;

import java.util.Optional;

public interface ExportJobRepository {

    ExportJob save(ExportJob job);

    Optional<ExportJob> findById(String eventId, String jobId);
}
