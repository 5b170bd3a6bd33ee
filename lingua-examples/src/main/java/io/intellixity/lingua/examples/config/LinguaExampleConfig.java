package io.intellixity.lingua.examples.config;

import io.intellixity.lingua.coordination.CoordinatorOptions;
import io.intellixity.lingua.coordination.LanguageCoordinator;
import io.intellixity.lingua.coordination.LanguageServer;
import io.intellixity.lingua.core.format.PersistenceFormat;
import io.intellixity.lingua.core.model.ContainerTypeRegistry;
import io.intellixity.lingua.examples.screen.DemoScreens;
import io.intellixity.lingua.examples.screen.Screen;
import io.intellixity.lingua.spi.engine.EngineRegistry;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

@Configuration
@EnableConfigurationProperties(LinguaProperties.class)
public class LinguaExampleConfig {

  @Bean
  public EngineRegistry engineRegistry() {
    // INI and JSON formats come from META-INF/lingua.factories on the classpath.
    return EngineRegistry.discover();
  }

  @Bean
  public ContainerTypeRegistry containerTypeRegistry() {
    return DemoScreens.registry();
  }

  @Bean(destroyMethod = "close")
  public LanguageServer languageServer(EngineRegistry registry, LinguaProperties props) throws IOException {
    Path root = Path.of(props.getRootPath()).toAbsolutePath().normalize();
    if (props.isCreateIfMissing()) Files.createDirectories(root.resolve(props.getLanguage()));
    LanguageServer server = new LanguageServer(registry);
    server.configure(props.getLanguage(), root, PersistenceFormat.fromId(props.getFormat()));
    return server;
  }

  @Bean
  public Screen orderScreen() {
    return DemoScreens.orderScreen();
  }

  @Bean(destroyMethod = "close")
  public LanguageCoordinator orderScreenCoordinator(LanguageServer server,
                                                    ContainerTypeRegistry types,
                                                    Screen orderScreen,
                                                    LinguaProperties props) throws IOException {
    CoordinatorOptions defaults = CoordinatorOptions.defaults(types);
    CoordinatorOptions options = defaults
        .withFormat(server.format())
        .withSettings(defaults.settings()
            .withCreateIfMissing(props.isCreateIfMissing())
            .withExcludeOnAction(props.isExcludeOnAction())
            .withExcludedTypes(props.getExcludedTypes())
            .withExcludedAttributes(props.getExcludedAttributes()));
    return LanguageCoordinator.open(server, orderScreen, options);
  }
}
