/*
 * Copyright 2026 Yellowbrick Data, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package ai.floedb.geoarrow.schema;

import java.time.ZoneOffset;
import java.util.Locale;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Integer time zone flags carried by date-time attributes.
 *
 * <p>Values above {@link #MIXED} encode a fixed offset as {@code UTC + quarterHours}, so {@code
 * 100} is UTC, {@code 104} is {@code +01:00} and {@code 80} is {@code -05:00}.
 */
public final class TimeZoneFlags {

  public static final int UNKNOWN = 0;
  public static final int LOCALTIME = 1;
  public static final int MIXED = 2;
  public static final int UTC = 100;

  private static final Pattern OFFSET =
      Pattern.compile("^([+-])(\\d{2})(?::?(\\d{2}))?$");

  private TimeZoneFlags() {}

  /**
   * Resolves an Arrow timestamp timezone string. Returns {@link #UNKNOWN} for a missing or empty
   * timezone and an empty result for a timezone that is not understood.
   */
  public static OptionalInt fromTimezone(String timezone) {
    if (timezone == null || timezone.isEmpty()) {
      return OptionalInt.of(UNKNOWN);
    }
    String normalized = timezone.trim().toUpperCase(Locale.ROOT);
    if (normalized.equals("UTC") || normalized.equals("ETC/UTC") || normalized.equals("Z")) {
      return OptionalInt.of(UTC);
    }
    Matcher matcher = OFFSET.matcher(normalized);
    if (!matcher.matches()) {
      return OptionalInt.empty();
    }
    int hours = Integer.parseInt(matcher.group(2));
    int minutes = matcher.group(3) == null ? 0 : Integer.parseInt(matcher.group(3));
    if (hours > 14 || minutes >= 60 || minutes % 15 != 0) {
      return OptionalInt.empty();
    }
    int quarters = hours * 4 + minutes / 15;
    return OptionalInt.of(matcher.group(1).equals("-") ? UTC - quarters : UTC + quarters);
  }

  public static boolean hasOffset(int flag) {
    return flag > MIXED;
  }

  public static ZoneOffset toOffset(int flag) {
    if (!hasOffset(flag)) {
      throw new IllegalArgumentException("Time zone flag carries no offset: " + flag);
    }
    return ZoneOffset.ofTotalSeconds((flag - UTC) * 15 * 60);
  }
}
