package com.deeplog.deeplog.context;

import jakarta.servlet.http.HttpSession;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/session")
public class ClientContextController {

    private final ClientContextService clientContextService;

    public ClientContextController(ClientContextService clientContextService) {
        this.clientContextService = clientContextService;
    }

    @GetMapping("/csrf")
    public ResponseEntity<ClientContextModels.CsrfTokenResponse> csrf(HttpSession session) {
        clientContextService.getOrCreateContextId(session);
        return ResponseEntity.ok(new ClientContextModels.CsrfTokenResponse(clientContextService.getOrCreateToken(session)));
    }
}
