package com.bbthechange.gallery.service.impl;

import com.bbthechange.gallery.config.ShareProperties;
import com.bbthechange.gallery.dto.ExportJobDTO;
import com.bbthechange.gallery.exception.AccessDeniedException;
import com.bbthechange.gallery.exception.ExportJobNotFoundException;
import com.bbthechange.gallery.model.EventStatus;
import com.bbthechange.gallery.model.ExportJob;
import com.bbthechange.gallery.model.ExportJobStatus;
import com.bbthechange.gallery.model.Host;
import com.bbthechange.gallery.repository.ExportJobRepository;
import com.bbthechange.gallery.security.Actor;
import com.bbthechange.gallery.security.DenyReason;
import com.bbthechange.gallery.security.OperationKind;
import com.bbthechange.gallery.service.EventLifecycleService;
import com.bbthechange.gallery.service.ExportWorker;
import com.bbthechange.gallery.service.PhotoStorage;
import com.bbthechange.gallery.testutil.GalleryTestData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("ExportJobService Tests")
class ExportJobServiceImplTest {

    @Mock
    private ExportJobRepository exportJobRepository;

    @Mock
    private EventLifecycleService eventLifecycleService;

    @Mock
    private ExportWorker exportWorker;

    @Mock
    private PhotoStorage photoStorage;

    private ExportJobServiceImpl service;
    private Host owner;
    private Actor ownerActor;
    private String eventId;

    @BeforeEach
    void setUp() {
        service = new ExportJobServiceImpl(exportJobRepository, eventLifecycleService, exportWorker, photoStorage,
            new ShareProperties());
        owner = GalleryTestData.host("owner@example.com");
        ownerActor = GalleryTestData.hostActor(owner);
        eventId = UUID.randomUUID().toString();
    }

    @Test
    void submit_ShouldQueueJobAndHandToWorker() {
        // Given
        when(eventLifecycleService.requireAccessible(ownerActor, eventId, OperationKind.EXPORT_EVENT))
            .thenReturn(GalleryTestData.event(owner.getHostId(), EventStatus.ACTIVE));
        when(exportJobRepository.save(any(ExportJob.class))).thenAnswer(invocation -> invocation.getArgument(0));

        // When
        ExportJobDTO dto = service.submit(ownerActor, eventId);

        // Then
        ArgumentCaptor<ExportJob> captor = ArgumentCaptor.forClass(ExportJob.class);
        verify(exportJobRepository).save(captor.capture());
        assertThat(captor.getValue().getRequestedBy()).isEqualTo(owner.getHostId());
        assertThat(dto.getStatus()).isEqualTo(ExportJobStatus.QUEUED);
        assertThat(dto.getDownloadUrl()).isNull();
        verify(exportWorker).process(eventId, dto.getJobId());
    }

    @Test
    void submit_WhenDenied_ShouldNotQueue() {
        when(eventLifecycleService.requireAccessible(ownerActor, eventId, OperationKind.EXPORT_EVENT))
            .thenThrow(new AccessDeniedException(DenyReason.NOT_OWNER, "Not the event owner"));

        assertThatThrownBy(() -> service.submit(ownerActor, eventId)).isInstanceOf(AccessDeniedException.class);
        verifyNoInteractions(exportJobRepository, exportWorker);
    }

    @Test
    void get_CompletedJob_ShouldIncludeDownloadUrl() {
        ExportJob job = new ExportJob(eventId, owner.getHostId());
        job.setStatus(ExportJobStatus.COMPLETED);
        job.setArchiveRef("exports/" + eventId + "/" + job.getJobId() + ".zip");
        job.setPhotoCount(3);
        when(exportJobRepository.findById(eventId, job.getJobId())).thenReturn(Optional.of(job));
        when(photoStorage.presignedGetUrl(eq(job.getArchiveRef()), any())).thenReturn("https://signed/zip");

        ExportJobDTO dto = service.get(ownerActor, eventId, job.getJobId());

        assertThat(dto.getDownloadUrl()).isEqualTo("https://signed/zip");
        assertThat(dto.getPhotoCount()).isEqualTo(3);
    }

    @Test
    void get_RunningJob_ShouldHaveNoDownloadUrl() {
        ExportJob job = new ExportJob(eventId, owner.getHostId());
        job.setStatus(ExportJobStatus.RUNNING);
        when(exportJobRepository.findById(eventId, job.getJobId())).thenReturn(Optional.of(job));

        assertThat(service.get(ownerActor, eventId, job.getJobId()).getDownloadUrl()).isNull();
        verifyNoInteractions(photoStorage);
    }

    @Test
    void get_UnknownJob_ShouldBeNotFound() {
        assertThatThrownBy(() -> service.get(ownerActor, eventId, "bogus"))
            .isInstanceOf(ExportJobNotFoundException.class);

        String missing = UUID.randomUUID().toString();
        when(exportJobRepository.findById(eventId, missing)).thenReturn(Optional.empty());
        assertThatThrownBy(() -> service.get(ownerActor, eventId, missing))
            .isInstanceOf(ExportJobNotFoundException.class);
    }
}
