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
import java.util.Objects;

/**
 * Streams WKT text into little-endian ISO WKB appended to a shared {@link WkbAppendBuffer}.
 * Element counts are written as placeholders and patched once the closing parenthesis is read.
 *
 * <p>Without a {@code Z}/{@code M}/{@code ZM} tag the dimensionality follows the first
 * coordinate tuple: three ordinates mean XYZ, four mean XYZM.
 */
public final class WktToWkbTranslator {

  private final WkbAppendBuffer out;

  public WktToWkbTranslator(WkbAppendBuffer out) {
    this.out = Objects.requireNonNull(out, "out");
  }

  public long translate(String wkt) throws IOException {
    return translate(ByteBuffer.wrap(wkt.getBytes(StandardCharsets.US_ASCII)));
  }

  /**
   * Appends the WKB of the WKT between the buffer's position and limit.
   *
   * @return number of bytes appended
   * @throws GeometryCapacityException when the output buffer cannot grow any further
   * @throws IOException when the text is not valid WKT
   */
  public long translate(ByteBuffer wkt) throws IOException {
    long first = out.size();
    WktLexer lexer = new WktLexer(wkt);
    geometry(lexer, null);
    if (!lexer.atEnd()) {
      throw lexer.error("Unexpected trailing characters");
    }
    return out.size() - first;
  }

  private void geometry(WktLexer lexer, GeometryType inherited) throws IOException {
    WktLexer.Header header = lexer.header();
    GeometryType type;
    if (header.explicit()) {
      type = header.type();
    } else if (inherited != null) {
      type = new GeometryType(header.type().kind(), inherited.hasZ(), inherited.hasM());
    } else {
      type = inferred(header.type().kind(), lexer.peekTupleDimension());
    }
    GeometryType childDefault = header.explicit() || inherited != null ? type : null;
    header(type);
    boolean empty = lexer.consumeWord("EMPTY");
    switch (type.kind()) {
      case POINT -> {
        if (empty) {
          emptyPoint(type);
        } else {
          lexer.expect('(');
          tuple(lexer, type);
          lexer.expect(')');
        }
      }
      case LINESTRING -> lineString(lexer, type, empty);
      case POLYGON -> polygon(lexer, type, empty);
      case MULTIPOINT -> multiPoint(lexer, type, empty);
      case MULTILINESTRING -> {
        long countAt = beginCount();
        int count = 0;
        if (!empty) {
          lexer.expect('(');
          do {
            header(type.withKind(GeometryKind.LINESTRING));
            lineString(lexer, type, lexer.consumeWord("EMPTY"));
            count++;
          } while (lexer.consume(','));
          lexer.expect(')');
        }
        out.setInt(countAt, count);
      }
      case MULTIPOLYGON -> {
        long countAt = beginCount();
        int count = 0;
        if (!empty) {
          lexer.expect('(');
          do {
            header(type.withKind(GeometryKind.POLYGON));
            polygon(lexer, type, lexer.consumeWord("EMPTY"));
            count++;
          } while (lexer.consume(','));
          lexer.expect(')');
        }
        out.setInt(countAt, count);
      }
      case GEOMETRYCOLLECTION -> {
        long countAt = beginCount();
        int count = 0;
        if (!empty) {
          lexer.expect('(');
          do {
            geometry(lexer, childDefault);
            count++;
          } while (lexer.consume(','));
          lexer.expect(')');
        }
        out.setInt(countAt, count);
      }
      case UNKNOWN -> throw lexer.error("Unsupported geometry type");
    }
  }

  private static GeometryType inferred(GeometryKind kind, int dimension) {
    return switch (dimension) {
      case 3 -> new GeometryType(kind, true, false);
      case 4 -> new GeometryType(kind, true, true);
      default -> GeometryType.of(kind);
    };
  }

  private void lineString(WktLexer lexer, GeometryType type, boolean empty) throws IOException {
    long countAt = beginCount();
    int count = 0;
    if (!empty) {
      lexer.expect('(');
      do {
        tuple(lexer, type);
        count++;
      } while (lexer.consume(','));
      lexer.expect(')');
    }
    out.setInt(countAt, count);
  }

  private void polygon(WktLexer lexer, GeometryType type, boolean empty) throws IOException {
    long countAt = beginCount();
    int count = 0;
    if (!empty) {
      lexer.expect('(');
      do {
        lineString(lexer, type, lexer.consumeWord("EMPTY"));
        count++;
      } while (lexer.consume(','));
      lexer.expect(')');
    }
    out.setInt(countAt, count);
  }

  /** Accepts both {@code MULTIPOINT (1 2, 3 4)} and {@code MULTIPOINT ((1 2), (3 4))}. */
  private void multiPoint(WktLexer lexer, GeometryType type, boolean empty) throws IOException {
    long countAt = beginCount();
    int count = 0;
    if (!empty) {
      lexer.expect('(');
      GeometryType pointType = type.withKind(GeometryKind.POINT);
      do {
        header(pointType);
        if (lexer.consumeWord("EMPTY")) {
          emptyPoint(pointType);
        } else if (lexer.consume('(')) {
          tuple(lexer, pointType);
          lexer.expect(')');
        } else {
          tuple(lexer, pointType);
        }
        count++;
      } while (lexer.consume(','));
      lexer.expect(')');
    }
    out.setInt(countAt, count);
  }

  private void header(GeometryType type) throws GeometryCapacityException {
    out.putByte(1);
    out.putInt(type.isoCode());
  }

  private long beginCount() throws GeometryCapacityException {
    long position = out.size();
    out.putInt(0);
    return position;
  }

  private void tuple(WktLexer lexer, GeometryType type) throws IOException {
    for (int i = 0; i < type.dimension(); i++) {
      out.putDouble(lexer.number());
    }
  }

  private void emptyPoint(GeometryType type) throws GeometryCapacityException {
    for (int i = 0; i < type.dimension(); i++) {
      out.putDouble(Double.NaN);
    }
  }
}
