package io.b2mash.b2b.reportscheduler.scheduledreport;

import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

/**
 * Decodes the raw {@code scheduler_options} value. Accepts a JSON string or an already-decoded
 * map. Anything that does not yield a non-empty JSON object decodes to {@link Optional#empty()}.
 */
@Component
public class SchedulerOptionsDecoder {

  private static final Logger log = LoggerFactory.getLogger(SchedulerOptionsDecoder.class);

  private final ObjectMapper objectMapper;

  public SchedulerOptionsDecoder(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  public Optional<SchedulerOptions> decode(Object raw) {
    if (raw instanceof Map<?, ?> map) {
      return fromMap(map);
    }
    if (!(raw instanceof CharSequence text) || text.toString().isBlank()) {
      return Optional.empty();
    }

    Object decoded;
    try {
      decoded = objectMapper.readValue(text.toString(), Object.class);
    } catch (JacksonException e) {
      log.debug("Failed to decode scheduler options: {}", e.getOriginalMessage());
      return Optional.empty();
    }

    if (decoded instanceof Map<?, ?> map) {
      return fromMap(map);
    }
    return Optional.empty();
  }

  private Optional<SchedulerOptions> fromMap(Map<?, ?> map) {
    if (map.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(SchedulerOptions.from(map));
  }
}
