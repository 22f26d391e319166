package com.temenos.transport;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import com.temenos.error.IntegrityException;
import com.temenos.error.InvalidRequestException;
import com.temenos.error.ProviderUnavailableException;

import reactor.core.publisher.Mono;

/**
 * Opens a transport-sealed chat request, shapes the history for the completion provider
 * and seals the reply. Plaintext exists only in memory for the duration of the call.
 */
@Service
public class HealingService {

    private static final Logger log = LoggerFactory.getLogger(HealingService.class);

    public static final String DEFAULT_MODEL = "r1-1776";
    public static final String DEFAULT_SYSTEM_PROMPT = """
            You are a literary writer with a close eye for emotional nuance and sensory detail. \
            Write vivid, immersive prose that engages all five senses, reveals character through \
            gesture and atmosphere, and lets the setting feel alive.""";

    static final int HISTORY_WINDOW = 10;
    static final int MAX_MESSAGE_LENGTH = 4000;

    private static final String SYSTEM = "system";
    private static final String USER = "user";
    private static final String ASSISTANT = "assistant";

    private final TransportCipher transport;
    private final ObjectProvider<CompletionProvider> providers;

    public HealingService(TransportCipher transport, ObjectProvider<CompletionProvider> providers) {
        this.transport = transport;
        this.providers = providers;
    }

    public Mono<HealingResponse> heal(HealingRequest request) {
        return Mono.fromCallable(() -> prepare(request))
                .flatMap(prepared -> prepared.provider().complete(prepared.model(), prepared.messages()))
                .map(reply -> new HealingResponse(transport.seal(reply)));
    }

    private Prepared prepare(HealingRequest request) {
        transport.requireKey();
        CompletionProvider provider = providers.getIfAvailable();
        if (provider == null) {
            throw new ProviderUnavailableException("No completion provider configured");
        }
        if (request == null || request.prompt() == null || request.prompt().isBlank()) {
            throw new InvalidRequestException("Prompt is required");
        }

        String prompt;
        String systemPrompt;
        List<ChatTurn> history = new ArrayList<>();
        try {
            prompt = transport.open(request.prompt());
            systemPrompt = request.systemPrompt() == null || request.systemPrompt().isBlank()
                    ? DEFAULT_SYSTEM_PROMPT
                    : transport.open(request.systemPrompt());
            if (request.messages() != null) {
                for (ChatTurn turn : request.messages()) {
                    history.add(new ChatTurn(turn.role(), transport.open(turn.content())));
                }
            }
        } catch (IntegrityException e) {
            log.warn("Rejected healing request: {}", e.getMessage());
            throw new InvalidRequestException("Failed to decrypt request data", e);
        }

        String model = request.model() == null || request.model().isBlank() ? DEFAULT_MODEL : request.model();
        return new Prepared(provider, model, buildMessages(systemPrompt, history, prompt));
    }

    /**
     * System message first, then the most recent turns kept only while they alternate
     * user/assistant, then the prompt as the final user turn (merged into a trailing user turn).
     */
    static List<ChatTurn> buildMessages(String systemPrompt, List<ChatTurn> history, String prompt) {
        List<ChatTurn> messages = new ArrayList<>();
        messages.add(new ChatTurn(SYSTEM, systemPrompt));

        List<ChatTurn> recent = history.subList(Math.max(0, history.size() - HISTORY_WINDOW), history.size());
        String expected = USER;
        for (ChatTurn turn : recent) {
            if (expected.equals(turn.role())) {
                messages.add(turn);
                expected = USER.equals(expected) ? ASSISTANT : USER;
            }
        }

        ChatTurn last = messages.get(messages.size() - 1);
        if (USER.equals(last.role())) {
            messages.set(messages.size() - 1, new ChatTurn(USER, last.content() + "\n\n" + prompt));
        } else {
            messages.add(new ChatTurn(USER, prompt));
        }

        return messages.stream().map(HealingService::truncate).toList();
    }

    private static ChatTurn truncate(ChatTurn turn) {
        String content = turn.content() == null ? "" : turn.content();
        if (content.length() <= MAX_MESSAGE_LENGTH) {
            return turn;
        }
        return new ChatTurn(turn.role(), content.substring(0, MAX_MESSAGE_LENGTH) + "...");
    }

    private record Prepared(CompletionProvider provider, String model, List<ChatTurn> messages) {}
}
