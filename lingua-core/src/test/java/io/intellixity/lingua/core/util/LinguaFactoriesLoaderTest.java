package io.intellixity.lingua.core.util;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

final class LinguaFactoriesLoaderTest {

  public interface Greeter {
    String greet();
  }

  public static final class Hello implements Greeter {
    @Override public String greet() { return "hello"; }
  }

  public static final class Ciao implements Greeter {
    @Override public String greet() { return "ciao"; }
  }

  @Test
  void loadsListedImplementationsInOrderWithoutDuplicates() {
    List<Greeter> greeters = LinguaFactoriesLoader.load(Greeter.class);
    assertEquals(2, greeters.size());
    assertEquals("hello", greeters.get(0).greet());
    assertEquals("ciao", greeters.get(1).greet());
  }

  @Test
  void unlistedSpiYieldsNothing() {
    assertTrue(LinguaFactoriesLoader.load(Runnable.class).isEmpty());
  }

  @Test
  void splitsCommaSeparatedValuesAndIgnoresBlanks() {
    Properties p = new Properties();
    p.setProperty(Greeter.class.getName(), " a.B , ,c.D,");
    assertEquals(List.of("a.B", "c.D"), LinguaFactoriesLoader.implementationNames(p, Greeter.class));
  }

  @Test
  void debugLogNamesTheLoadedImplementations() {
    Logger logger = (Logger) LoggerFactory.getLogger(LinguaFactoriesLoader.class);
    Level previous = logger.getLevel();
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    logger.setLevel(Level.DEBUG);
    try {
      LinguaFactoriesLoader.load(Greeter.class);
    } finally {
      logger.detachAppender(appender);
      logger.setLevel(previous);
    }

    List<String> messages = appender.list.stream().map(ILoggingEvent::getFormattedMessage).toList();
    assertTrue(messages.stream().anyMatch(m -> m.startsWith("lingua.factories op=read") && m.contains("listed=3")));
    assertTrue(messages.stream().anyMatch(m -> m.startsWith("lingua.factories op=load")
        && m.contains(Hello.class.getName()) && m.contains(Ciao.class.getName())));
  }
}
