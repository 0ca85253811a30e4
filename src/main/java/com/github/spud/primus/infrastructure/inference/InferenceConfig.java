package com.github.spud.primus.infrastructure.inference;

import com.github.spud.primus.domain.inference.InferenceBackend;
import com.github.spud.primus.domain.inference.InferenceUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.publisher.Mono;

/**
 * 推理后端配置：有 ChatModel 时走 Spring AI，否则返回不可用错误
 */
@Slf4j
@Configuration
public class InferenceConfig {

  @Bean
  public InferenceBackend inferenceBackend(ObjectProvider<ChatModel> chatModel) {
    ChatModel model = chatModel.getIfAvailable();
    if (model == null) {
      log.warn("No ChatModel configured, chat turns will fail until one is provided");
      return (prompt, context) -> Mono.error(
        new InferenceUnavailableException("No inference model is configured"));
    }
    log.info("Using {} for inference", model.getClass().getSimpleName());
    return new ChatClientInferenceBackend(ChatClient.builder(model).build());
  }
}
