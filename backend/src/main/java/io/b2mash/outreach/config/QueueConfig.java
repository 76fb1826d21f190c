package io.b2mash.outreach.config;

import io.b2mash.outreach.queue.DeliveryProvider;
import io.b2mash.outreach.queue.NoOpDeliveryProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class QueueConfig {

  @Bean
  @ConditionalOnMissingBean(DeliveryProvider.class)
  DeliveryProvider noOpDeliveryProvider() {
    return new NoOpDeliveryProvider();
  }
}
