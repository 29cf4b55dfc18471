package helpers;

import com.google.common.base.*;

import org.slf4j.*;

/**
 * LogHelper
 *
 * <p>space-joins its args and hands the line to the owner's slf4j logger
 */
public class LogHelper {

  private final Object self;

  /**
   * ctor
   *
   * @param self the owning object, its class names the logger
   */
  public LogHelper(Object self) {
    this.self = self;
  }

  private Logger logger() {
    return LoggerFactory.getLogger(self instanceof Class ? (Class<?>) self : self.getClass());
  }

  public String str(Object... args) {
    return Joiner.on(" ").useForNull("null").join(args);
  }

  // ctlplane
  public void debug(Object... args) {
    Logger logger = logger();
    if (logger.isDebugEnabled())
      logger.debug(str(args));
  }

  // dataplane
  public void trace(Object... args) {
    Logger logger = logger();
    if (logger.isTraceEnabled())
      logger.trace(str(args));
  }

  public void info(Object... args) {
    Logger logger = logger();
    if (logger.isInfoEnabled())
      logger.info(str(args));
  }

  public void warn(Object... args) {
    Logger logger = logger();
    if (logger.isWarnEnabled())
      logger.warn(str(args));
  }

}
