package io.b2mash.b2b.reportscheduler.codeset;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.stereotype.Service;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

/**
 * {@link EnumSource} backed by JSON code set packs on the classpath. Packs are read once at
 * construction; the resulting code maps are immutable and safe to share between threads.
 */
@Service
@EnableConfigurationProperties(CodeSetProperties.class)
public class ClasspathEnumSource implements EnumSource {

  private static final Logger log = LoggerFactory.getLogger(ClasspathEnumSource.class);

  private final Map<String, Map<String, String>> codeMaps;

  public ClasspathEnumSource(
      ResourcePatternResolver resourceResolver,
      ObjectMapper objectMapper,
      CodeSetProperties properties) {
    this.codeMaps = loadCodeMaps(resourceResolver, objectMapper, properties.location());
  }

  @Override
  public Map<String, String> getCodeMap(String endpoint) {
    var codes = codeMaps.get(endpoint);
    if (codes == null) {
      log.debug("No code set registered for endpoint {}", endpoint);
      return Map.of();
    }
    return codes;
  }

  private static Map<String, Map<String, String>> loadCodeMaps(
      ResourcePatternResolver resourceResolver, ObjectMapper objectMapper, String location) {
    Resource[] resources;
    try {
      resources = resourceResolver.getResources(location);
    } catch (IOException e) {
      log.warn("Failed to scan for code set packs at {}", location, e);
      return Map.of();
    }
    if (resources.length == 0) {
      log.warn("No code set packs found at {}", location);
    }

    var result = new LinkedHashMap<String, Map<String, String>>();
    for (Resource resource : resources) {
      var pack = readPack(objectMapper, resource);
      if (pack.endpoint() == null || pack.endpoint().isBlank()) {
        throw new IllegalStateException(
            "Code set pack " + resource.getFilename() + " does not declare an endpoint");
      }
      var previous =
          result.putIfAbsent(
              pack.endpoint(), Collections.unmodifiableMap(new LinkedHashMap<>(pack.codes())));
      if (previous != null) {
        throw new IllegalStateException(
            "Code set pack "
                + resource.getFilename()
                + " redefines endpoint "
                + pack.endpoint());
      }
      log.info(
          "Loaded code set {} ({} codes) from {}",
          pack.endpoint(),
          pack.codes().size(),
          resource.getFilename());
    }
    return Collections.unmodifiableMap(result);
  }

  private static CodeSetPackDefinition readPack(ObjectMapper objectMapper, Resource resource) {
    try (InputStream in = resource.getInputStream()) {
      return objectMapper.readValue(in, CodeSetPackDefinition.class);
    } catch (IOException | JacksonException e) {
      throw new IllegalStateException("Unreadable code set pack " + resource.getFilename(), e);
    }
  }
}
