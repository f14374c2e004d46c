/*-
 * #%L
 * This file is part of DbView.
 * %%
 * Copyright (C) 2026 DbView developers
 * %%
 * DbView is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * DbView is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with DbView.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */


package dbview.lib.gui.logging;

import java.io.File;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.FileAppender;
import javafx.beans.property.ObjectProperty;
import javafx.beans.property.SimpleObjectProperty;

/**
 * Manage logging levels, and optional logging to a file.
 * <p>
 * This requires Logback as the SLF4J binding; with any other binding, requests are only logged as warnings.
 * 
 * @author DbView developers
 */
public class LogManager {
	
	private static final Logger logger = LoggerFactory.getLogger(LogManager.class);
	
	/**
	 * Available log levels.
	 */
	public static enum LogLevel {
		/**
		 * Trace logging (an awful lot of messages)
		 */
		TRACE,
		/**
		 * Debug logging (a lot of messages)
		 */
		DEBUG,
		/**
		 * Info logging (default)
		 */
		INFO,
		/**
		 * Warn logging (only if something is moderately important)
		 */
		WARN,
		/**
		 * Error logging (only if something goes recognizably wrong)
		 */
		ERROR,
		/**
		 * All log messages
		 */
		ALL,
		/**
		 * Turn off logging
		 */
		OFF;
	}
	
	private static ObjectProperty<LogLevel> logLevelProperty = new SimpleObjectProperty<>(LogLevel.INFO);
	
	static {
		logLevelProperty.addListener((v, o, n) -> {
			if (n != null)
				applyRootLogLevel(n);
		});
	}
	
	static Level getLevel(LogLevel logLevel) {
		switch(logLevel) {
		case DEBUG:
			return Level.DEBUG;
		case ERROR:
			return Level.ERROR;
		case INFO:
			return Level.INFO;
		case ALL:
			return Level.ALL;
		case OFF:
			return Level.OFF;
		case TRACE:
			return Level.TRACE;
		case WARN:
			return Level.WARN;
		default:
			return Level.INFO;
		}
	}
	
	private static LoggerContext getLoggerContext() {
		if (LoggerFactory.getILoggerFactory() instanceof LoggerContext) {
			return (LoggerContext)LoggerFactory.getILoggerFactory();
		} else
			return null;
	}
	
	private static ch.qos.logback.classic.Logger getRootLogger() {
		var context = getLoggerContext();
		return context == null ? null : context.getLogger(Logger.ROOT_LOGGER_NAME);
	}
	
	private static void applyRootLogLevel(LogLevel logLevel) {
		var root = getRootLogger();
		if (root != null)
			root.setLevel(getLevel(logLevel));
		else
			logger.warn("Cannot set the root log level without logback!");
	}
	
	/**
	 * Request logging to the specified file, in addition to any other appenders.
	 * @param file
	 * @return true if a file appender was added
	 */
	public static boolean logToFile(File file) {
		var context = getLoggerContext();
		if (context == null) {
			logger.warn("Cannot log to {} without logback!", file);
			return false;
		}
		FileAppender<ILoggingEvent> appender = new FileAppender<>();
		
		PatternLayoutEncoder encoder = new PatternLayoutEncoder();
		encoder.setContext(context);
		encoder.setPattern("%d{HH:mm:ss.SSS} [%thread] [%-5level] %logger{36} - %msg%n");
		encoder.start();
			    
		appender.setFile(file.getAbsolutePath());
		appender.setContext(context);
		appender.setEncoder(encoder);
		appender.setName(file.getName());
		appender.start();
		context.getLogger(Logger.ROOT_LOGGER_NAME).addAppender(appender);
		logger.debug("Logging to {}", file.getAbsolutePath());
		return true;
	}
	
	/**
	 * Set the root log level.
	 * @param level
	 */
	public static void setRootLogLevel(LogLevel level) {
		logLevelProperty.set(level);
	}
	
	/**
	 * Get the root log level, as set by this manager.
	 * This is not guaranteed to match the actual root log level, in case it has been set elsewhere.
	 * @return 
	 */
	public static LogLevel getRootLogLevel() {
		return logLevelProperty.get();
	}
	
	/**
	 * Property representing the current requested root log level.
	 * @return
	 */
	public static ObjectProperty<LogLevel> rootLogLevelProperty() {
		return logLevelProperty;
	}
	
	/**
	 * Get the level actually used by the root logger.
	 * @return the level, or null if logback is not the logging backend
	 */
	public static Level getEffectiveRootLevel() {
		var root = getRootLogger();
		return root == null ? null : root.getEffectiveLevel();
	}

}
