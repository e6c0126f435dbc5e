package com.moddock.api.thread;

import com.moddock.api.auth.Authenticator;
import com.moddock.api.error.NotFoundException;
import com.moddock.api.ids.Base62;
import com.moddock.api.ids.MalformedTokenException;
import com.moddock.core.domain.MessageBody;
import com.moddock.core.domain.User;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Report discussion threads: read the conversation, add to it.
 */
@RestController
@RequestMapping("/v2/thread")
public class ThreadController {

    private final ThreadService threadService;
    private final Authenticator authenticator;

    public ThreadController(ThreadService threadService, Authenticator authenticator) {
        this.threadService = threadService;
        this.authenticator = authenticator;
    }

    @GetMapping("/{id}")
    public ResponseEntity<ThreadResponse> get(HttpServletRequest request, @PathVariable("id") String id) {
        User user = authenticator.authenticate(request);
        return ResponseEntity.ok(ThreadResponse.from(threadService.getThreadFor(user, parseId(id))));
    }

    @PostMapping("/{id}")
    public ResponseEntity<Void> post(
            HttpServletRequest request,
            @PathVariable("id") String id,
            @Valid @RequestBody PostMessageRequest message) {
        User user = authenticator.authenticate(request);
        threadService.postUserMessage(user, parseId(id), message.body());
        return ResponseEntity.noContent().build();
    }

    private long parseId(String id) {
        try {
            return Base62.decode(id);
        } catch (MalformedTokenException e) {
            throw new NotFoundException("Thread " + id + " not found");
        }
    }

    public record PostMessageRequest(
            @NotBlank @Size(max = MessageBody.MAX_TEXT_LENGTH) String body
    ) {}
}
