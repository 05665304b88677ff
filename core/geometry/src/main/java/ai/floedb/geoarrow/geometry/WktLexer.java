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

package ai.floedb.geoarrow.geometry;

import ai.floedb.geoarrow.schema.GeometryKind;
import ai.floedb.geoarrow.schema.GeometryType;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/** Tokenizer over ASCII WKT held in a byte buffer. */
final class WktLexer {

  /**
   * A geometry keyword with its dimensionality tag.
   *
   * @param explicit whether a {@code Z}, {@code M} or {@code ZM} tag was present
   */
  record Header(GeometryType type, boolean explicit) {}

  private final ByteBuffer text;
  private final int start;
  private final int end;
  private int pos;

  WktLexer(ByteBuffer text) {
    this.text = text;
    this.start = text.position();
    this.end = text.limit();
    this.pos = start;
  }

  boolean atEnd() {
    skipWhitespace();
    return pos >= end;
  }

  boolean consume(char c) {
    skipWhitespace();
    if (pos < end && text.get(pos) == c) {
      pos++;
      return true;
    }
    return false;
  }

  void expect(char c) throws IOException {
    if (!consume(c)) {
      throw error("Expected '" + c + "'");
    }
  }

  /** Consumes {@code word} when it is the next token, ignoring case. */
  boolean consumeWord(String word) {
    int saved = pos;
    if (word().equals(word)) {
      return true;
    }
    pos = saved;
    return false;
  }

  Header header() throws IOException {
    String word = word();
    if (word.isEmpty()) {
      throw error("Expected a geometry keyword");
    }
    String tag = "";
    GeometryKind kind = GeometryKind.fromName(word);
    if (kind == GeometryKind.UNKNOWN) {
      for (String suffix : new String[] {"ZM", "Z", "M"}) {
        if (word.endsWith(suffix)) {
          kind = GeometryKind.fromName(word.substring(0, word.length() - suffix.length()));
          if (kind != GeometryKind.UNKNOWN) {
            tag = suffix;
            break;
          }
        }
      }
    }
    if (kind == GeometryKind.UNKNOWN) {
      throw error("Unknown geometry keyword " + word);
    }
    if (tag.isEmpty()) {
      int saved = pos;
      String next = word();
      if (next.equals("Z") || next.equals("M") || next.equals("ZM")) {
        tag = next;
      } else {
        pos = saved;
      }
    }
    return new Header(
        new GeometryType(kind, tag.contains("Z"), tag.contains("M")), !tag.isEmpty());
  }

  /**
   * Counts the ordinates of the first coordinate tuple ahead without consuming anything. Returns
   * {@code 0} when no tuple follows.
   */
  int peekTupleDimension() {
    int p = pos;
    while (p < end && !isNumberStart(text.get(p))) {
      p++;
    }
    int count = 0;
    while (p < end) {
      byte b = text.get(p);
      if (b == ',' || b == ')') {
        break;
      }
      if (isNumberStart(b)) {
        count++;
        while (p < end && isNumberChar(text.get(p))) {
          p++;
        }
        continue;
      }
      p++;
    }
    return count;
  }

  double number() throws IOException {
    skipWhitespace();
    int first = pos;
    while (pos < end && isNumberChar(text.get(pos))) {
      pos++;
    }
    if (first == pos) {
      throw error("Expected a number");
    }
    byte[] token = new byte[pos - first];
    text.get(first, token);
    try {
      return Double.parseDouble(new String(token, StandardCharsets.US_ASCII));
    } catch (NumberFormatException e) {
      pos = first;
      throw error("Invalid number");
    }
  }

  IOException error(String message) {
    return new IOException(message + " in WKT at offset " + (pos - start));
  }

  private String word() {
    skipWhitespace();
    int first = pos;
    pos = skipLetters(pos);
    byte[] token = new byte[pos - first];
    text.get(first, token);
    return new String(token, StandardCharsets.US_ASCII).toUpperCase(Locale.ROOT);
  }

  private int skipLetters(int p) {
    while (p < end && isLetter(text.get(p))) {
      p++;
    }
    return p;
  }

  private void skipWhitespace() {
    while (pos < end && Character.isWhitespace(text.get(pos))) {
      pos++;
    }
  }

  private static boolean isLetter(byte b) {
    return (b >= 'A' && b <= 'Z') || (b >= 'a' && b <= 'z');
  }

  private static boolean isDigit(byte b) {
    return b >= '0' && b <= '9';
  }

  private static boolean isNumberStart(byte b) {
    return isDigit(b) || b == '-' || b == '+' || b == '.';
  }

  private static boolean isNumberChar(byte b) {
    return isNumberStart(b) || b == 'e' || b == 'E';
  }
}
