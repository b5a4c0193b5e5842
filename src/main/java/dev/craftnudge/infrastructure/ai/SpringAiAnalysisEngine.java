package dev.craftnudge.infrastructure.ai;

import dev.craftnudge.config.AgentProperties;
import dev.craftnudge.config.AiProperties;
import dev.craftnudge.domain.enums.AgentKind;
import dev.craftnudge.domain.valueobject.CommitSnapshot;
import dev.craftnudge.exception.AnalysisPermanentException;
import dev.craftnudge.exception.AnalysisTransientException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;

import java.util.List;

/**
 * {@link AnalysisEngine} backed by a Spring AI {@link ChatModel}. Each agent
 * kind has its own model, temperature and system prompt.
 *
 * <p>Error mapping: unreachable model, rate limits and 5xx are transient;
 * rejected requests and empty answers are permanent.
 */
@Component
public class SpringAiAnalysisEngine implements AnalysisEngine {

    private static final Logger log = LoggerFactory.getLogger(SpringAiAnalysisEngine.class);

    private final ChatModel chatModel;
    private final AgentProperties agentProperties;
    private final AiProperties aiProperties;

    public SpringAiAnalysisEngine(ChatModel chatModel, AgentProperties agentProperties, AiProperties aiProperties) {
        this.chatModel = chatModel;
        this.agentProperties = agentProperties;
        this.aiProperties = aiProperties;
    }

    @Override
    @CircuitBreaker(name = "analysis-engine") @RateLimiter(name = "analysis-engine")
    public AnalysisText analyze(CommitSnapshot commit, String diffSummary, AgentKind kind) {
        AgentProperties.AgentConfig config = agentProperties.forKind(kind);
        ChatOptions options = ChatOptions.builder()
                .model(config.model())
                .temperature(config.temperature())
                .maxTokens(aiProperties.maxOutputTokens())
                .build();
        Prompt prompt = new Prompt(List.of(
                new SystemMessage(PromptUtils.systemPrompt(kind)),
                new UserMessage(PromptUtils.userPrompt(kind, commit, diffSummary))), options);

        log.debug("Requesting {} of {} from {}", kind, commit.shortHash(), config.model());
        ChatResponse response;
        try {
            response = chatModel.call(prompt);
        } catch (TransientAiException | ResourceAccessException e) {
            throw new AnalysisTransientException("Model %s unavailable: %s".formatted(config.model(), e.getMessage()), e);
        } catch (NonTransientAiException e) {
            throw new AnalysisPermanentException("Model %s rejected request: %s".formatted(config.model(), e.getMessage()), e);
        }

        String text = response == null || response.getResult() == null || response.getResult().getOutput() == null
                ? null : response.getResult().getOutput().getText();
        if (text == null || text.isBlank())
            throw new AnalysisPermanentException("Model %s returned an empty analysis".formatted(config.model()));
        return new AnalysisText(text.strip(), config.model());
    }
}
