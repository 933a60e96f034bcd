package cafe.woden.huddle;

import cafe.woden.huddle.config.HuddleProperties;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.modulith.Modulithic;

/**
 * Realtime layer host. Transports attach through {@link
 * cafe.woden.huddle.protocol.ConnectionGateway}.
 */
@SpringBootApplication
@Modulithic(
    systemName = "Huddle",
    sharedModules = {"config", "model", "util"})
@EnableConfigurationProperties(HuddleProperties.class)
public class HuddleApp {

  public static void main(String[] args) {
    new SpringApplicationBuilder(HuddleApp.class).web(WebApplicationType.NONE).run(args);
  }
}
