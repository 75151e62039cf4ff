// Copyright (c) 2025, the R8 project authors. Please see the AUTHORS file
// for details. All rights reserved. Use of this source code is governed by a
// BSD-style license that can be found in the LICENSE file.
package com.calltree;

import com.calltree.profiler.LineConsumer;
import com.calltree.profiler.LogicalThreadContext;
import com.calltree.utils.SystemPropertyUtils;
import com.calltree.utils.timing.Clock;
import java.util.Locale;

/**
 * Profiler configuration. {@link #fromEnvironment()} reads the configuration of the process:
 *
 * <ul>
 *   <li>{@code -Dcalltree.profile} or {@code CALLTREE_PROFILE}: profiling is enabled if set to a
 *       non-empty value. A number doubles as the minimum report time in milliseconds.
 *   <li>{@code -Dcalltree.profile.minvalue_ms}: minimum report time in milliseconds, default 10.
 *   <li>{@code -Dcalltree.profile.clock}: {@code cpu} or {@code wall}. Defaults to {@code cpu} if
 *       the JVM can measure thread CPU time.
 * </ul>
 */
public class ProfileOptions {

  public static final String ENABLE_PROPERTY = "calltree.profile";
  public static final String ENABLE_ENVIRONMENT_VARIABLE = "CALLTREE_PROFILE";
  public static final String MINIMUM_REPORT_MS_PROPERTY = "calltree.profile.minvalue_ms";
  public static final String CLOCK_PROPERTY = "calltree.profile.clock";

  public static final int DEFAULT_MINIMUM_REPORT_MS = 10;

  private final boolean enabled;
  private final int minimumReportMs;
  private final Clock.Kind clockKind;
  private final Clock clock;
  private final LogicalThreadContext logicalThreadContext;
  private final LineConsumer console;

  private ProfileOptions(
      boolean enabled,
      int minimumReportMs,
      Clock.Kind clockKind,
      Clock clock,
      LogicalThreadContext logicalThreadContext,
      LineConsumer console) {
    this.enabled = enabled;
    this.minimumReportMs = minimumReportMs;
    this.clockKind = clockKind;
    this.clock = clock;
    this.logicalThreadContext = logicalThreadContext;
    this.console = console;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static ProfileOptions disabled() {
    return builder().setEnabled(false).build();
  }

  public static ProfileOptions fromEnvironment() {
    String enable =
        SystemPropertyUtils.getSystemPropertyOrEnvironmentVariable(
            ENABLE_PROPERTY, ENABLE_ENVIRONMENT_VARIABLE);
    return builder()
        .setEnabled(enable != null && !enable.isEmpty())
        .setMinimumReportMs(
            SystemPropertyUtils.parseSystemPropertyOrDefault(
                MINIMUM_REPORT_MS_PROPERTY, parseMinimumReportMs(enable)))
        .setClockKind(
            SystemPropertyUtils.applySystemProperty(
                CLOCK_PROPERTY, ProfileOptions::parseClockKind, defaultClockKind()))
        .build();
  }

  // The enable switch is also read as a number, where zero and non-numbers mean the default.
  static int parseMinimumReportMs(String value) {
    int parsed = SystemPropertyUtils.parseOrDefault(value, DEFAULT_MINIMUM_REPORT_MS);
    return parsed > 0 ? parsed : DEFAULT_MINIMUM_REPORT_MS;
  }

  static Clock.Kind parseClockKind(String value) {
    switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "cpu":
        return Clock.isCpuTimeSupported() ? Clock.Kind.CPU : Clock.Kind.WALL;
      case "wall":
        return Clock.Kind.WALL;
      default:
        return defaultClockKind();
    }
  }

  private static Clock.Kind defaultClockKind() {
    return Clock.isCpuTimeSupported() ? Clock.Kind.CPU : Clock.Kind.WALL;
  }

  public boolean isEnabled() {
    return enabled;
  }

  public int getMinimumReportMs() {
    return minimumReportMs;
  }

  public Clock.Kind getClockKind() {
    return clock != null ? clock.getKind() : clockKind;
  }

  public Clock getClock() {
    return clock != null ? clock : Clock.of(clockKind);
  }

  public LogicalThreadContext getLogicalThreadContext() {
    return logicalThreadContext;
  }

  public LineConsumer getConsole() {
    return console;
  }

  public static class Builder {

    private boolean enabled = false;
    private int minimumReportMs = DEFAULT_MINIMUM_REPORT_MS;
    private Clock.Kind clockKind = null;
    private Clock clock = null;
    private LogicalThreadContext logicalThreadContext = null;
    private LineConsumer console = null;

    private Builder() {}

    public Builder setEnabled(boolean enabled) {
      this.enabled = enabled;
      return this;
    }

    public Builder setMinimumReportMs(int minimumReportMs) {
      this.minimumReportMs = minimumReportMs;
      return this;
    }

    public Builder setClockKind(Clock.Kind clockKind) {
      this.clockKind = clockKind;
      return this;
    }

    /** Uses {@code clock} instead of a clock of the configured kind. */
    public Builder setClock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public Builder setLogicalThreadContext(LogicalThreadContext logicalThreadContext) {
      this.logicalThreadContext = logicalThreadContext;
      return this;
    }

    public Builder setConsole(LineConsumer console) {
      this.console = console;
      return this;
    }

    public ProfileOptions build() {
      return new ProfileOptions(
          enabled,
          minimumReportMs,
          clockKind != null ? clockKind : defaultClockKind(),
          clock,
          logicalThreadContext != null ? logicalThreadContext : LogicalThreadContext.perThread(),
          console != null ? console : LineConsumer.console());
    }
  }
}
