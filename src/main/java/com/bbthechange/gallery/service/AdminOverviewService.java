package com.bbthechange.gallery.service;

import com.bbthechange.gallery.dto.AdminOverviewResponse;
import com.bbthechange.gallery.dto.RecentUploadDTO;
import com.bbthechange.gallery.security.Actor;

import java.util.List;

public interface AdminOverviewService {

    AdminOverviewResponse overview(Actor actor);

    List<RecentUploadDTO> recentUploads(Actor actor, int limit);
}
