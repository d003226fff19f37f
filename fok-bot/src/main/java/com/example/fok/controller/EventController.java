package com.example.fok.controller;

import com.example.fok.inbound.BotReply;
import com.example.fok.inbound.EventRouter;
import com.example.fok.inbound.InboundEvent;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/events")
public class EventController {

    private final EventRouter eventRouter;

    public EventController(EventRouter eventRouter) {
        this.eventRouter = eventRouter;
    }

    @PostMapping
    public ResponseEntity<BotReply> receive(@Valid @RequestBody InboundEvent event) {
        return ResponseEntity.ok(eventRouter.route(event));
    }
}
