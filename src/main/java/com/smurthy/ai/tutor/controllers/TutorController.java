package com.smurthy.ai.tutor.controllers;

import com.smurthy.ai.tutor.dto.AskRequest;
import com.smurthy.ai.tutor.dto.AskResponse;
import com.smurthy.ai.tutor.orchestration.Supervisor;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Tutoring endpoint. One request, one answer.
 */
@RestController
@RequestMapping("/api/tutor")
public class TutorController {

    private final Supervisor supervisor;

    public TutorController(Supervisor supervisor) {
        this.supervisor = supervisor;
    }

    @PostMapping("/ask")
    public AskResponse ask(@Valid @RequestBody AskRequest request) {
        return AskResponse.from(supervisor.handle(request.toQuery(), request.toProfile()));
    }
}
