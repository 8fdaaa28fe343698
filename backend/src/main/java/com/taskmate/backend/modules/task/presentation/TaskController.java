package com.taskmate.backend.modules.task.presentation;

import java.util.UUID;

import com.taskmate.backend.global.security.JwtAuthenticationPrincipal;
import com.taskmate.backend.modules.task.application.TaskService;
import com.taskmate.backend.modules.task.presentation.dto.CreateTaskRequest;
import com.taskmate.backend.modules.task.presentation.dto.DeleteTaskResponse;
import com.taskmate.backend.modules.task.presentation.dto.TaskListResponse;
import com.taskmate.backend.modules.task.presentation.dto.TaskResponse;
import com.taskmate.backend.modules.task.presentation.dto.UpdateTaskRequest;

import jakarta.validation.Valid;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/tasks")
@SecurityRequirement(name = "bearerAuth")
public class TaskController {

    private final TaskService taskService;

    public TaskController(TaskService taskService) {
        this.taskService = taskService;
    }

    @PostMapping
    public ResponseEntity<TaskResponse> createTask(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @Valid @RequestBody CreateTaskRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(taskService.createTask(principal.userId(), request));
    }

    @Operation(summary = "List the caller's tasks", description = "Newest first. Counts cover every task the caller owns.")
    @GetMapping
    public ResponseEntity<TaskListResponse> listTasks(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @RequestParam(name = "limit", required = false) Integer limit,
            @RequestParam(name = "offset", required = false) Integer offset
    ) {
        return ResponseEntity.ok(taskService.listTasks(principal.userId(), limit, offset));
    }

    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Task found"),
            @ApiResponse(responseCode = "403", description = "Task belongs to another user"),
            @ApiResponse(responseCode = "404", description = "Task does not exist")
    })
    @GetMapping("/{taskId}")
    public ResponseEntity<TaskResponse> getTask(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable UUID taskId
    ) {
        return ResponseEntity.ok(taskService.getTask(principal.userId(), taskId));
    }

    @PutMapping("/{taskId}")
    public ResponseEntity<TaskResponse> updateTask(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable UUID taskId,
            @RequestBody UpdateTaskRequest request
    ) {
        return ResponseEntity.ok(taskService.updateTask(principal.userId(), taskId, request));
    }

    @DeleteMapping("/{taskId}")
    public ResponseEntity<DeleteTaskResponse> deleteTask(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable UUID taskId
    ) {
        return ResponseEntity.ok(taskService.deleteTask(principal.userId(), taskId));
    }

    @PatchMapping("/{taskId}/toggle")
    public ResponseEntity<TaskResponse> toggleTask(
            @AuthenticationPrincipal JwtAuthenticationPrincipal principal,
            @PathVariable UUID taskId
    ) {
        return ResponseEntity.ok(taskService.toggleTask(principal.userId(), taskId));
    }
}
