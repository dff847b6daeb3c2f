package com.awardhub.backend.modules.notification.presentation;

import java.util.UUID;

import com.awardhub.backend.global.security.SecurityUtils;
import com.awardhub.backend.modules.notification.application.NotificationService;
import com.awardhub.backend.modules.notification.domain.NotificationType;
import com.awardhub.backend.modules.notification.presentation.dto.MarkAllReadRequest;
import com.awardhub.backend.modules.notification.presentation.dto.MarkAllReadResponse;
import com.awardhub.backend.modules.notification.presentation.dto.MarkReadResponse;
import com.awardhub.backend.modules.notification.presentation.dto.NotificationDetailResponse;
import com.awardhub.backend.modules.notification.presentation.dto.NotificationListResponse;
import com.awardhub.backend.modules.notification.presentation.dto.NotificationStatsResponse;

import io.swagger.v3.oas.annotations.Operation;

import jakarta.validation.Valid;

import org.springframework.data.domain.PageRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/notifications")
public class NotificationController {

    private static final int MAX_PAGE_SIZE = 100;

    private final NotificationService notificationService;

    public NotificationController(NotificationService notificationService) {
        this.notificationService = notificationService;
    }

    @Operation(summary = "Notification feed", description = "Newest first, with total/unread/read counts.")
    @GetMapping
    public ResponseEntity<NotificationListResponse> list(
            @RequestParam(name = "read", required = false) Boolean read,
            @RequestParam(name = "type", required = false) NotificationType type,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size
    ) {
        int safePage = Math.max(page, 0);
        int safeSize = Math.min(Math.max(size, 1), MAX_PAGE_SIZE);
        return ResponseEntity.ok(notificationService.list(
                SecurityUtils.getCurrentUserId(), read, type, PageRequest.of(safePage, safeSize)));
    }

    @GetMapping("/stats")
    public ResponseEntity<NotificationStatsResponse> stats() {
        return ResponseEntity.ok(notificationService.stats(SecurityUtils.getCurrentUserId()));
    }

    @Operation(summary = "Notification detail", description = "Marks the notification as read.")
    @GetMapping("/{notificationId}")
    public ResponseEntity<NotificationDetailResponse> get(@PathVariable("notificationId") UUID notificationId) {
        return ResponseEntity.ok(notificationService.get(SecurityUtils.getCurrentUserId(), notificationId));
    }

    @PatchMapping("/{notificationId}/read")
    public ResponseEntity<MarkReadResponse> markRead(@PathVariable("notificationId") UUID notificationId) {
        return ResponseEntity.ok(notificationService.markRead(SecurityUtils.getCurrentUserId(), notificationId));
    }

    @PostMapping("/read-all")
    public ResponseEntity<MarkAllReadResponse> markAllRead(
            @Valid @RequestBody(required = false) MarkAllReadRequest request
    ) {
        return ResponseEntity.ok(notificationService.markAllRead(
                SecurityUtils.getCurrentUserId(), request == null ? null : request.notificationIds()));
    }
}
