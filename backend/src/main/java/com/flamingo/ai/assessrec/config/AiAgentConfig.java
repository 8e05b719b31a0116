package com.flamingo.ai.assessrec.config;

import com.flamingo.ai.assessrec.agent.AssessmentRerankerAgent;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for AI agents built with LangChain4j AI Services. Agents exist only when the
 * strategy that needs them is selected.
 */
@Configuration
@ConditionalOnProperty(name = "recommender.reranking.strategy", havingValue = "llm")
public class AiAgentConfig {

  /** Scores candidate assessments against a hiring query with a single batched prompt. */
  @Bean
  public AssessmentRerankerAgent assessmentRerankerAgent(ChatModel chatModel) {
    return AiServices.builder(AssessmentRerankerAgent.class).chatModel(chatModel).build();
  }
}
