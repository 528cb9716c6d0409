/*
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
package io.ricegrep.index.hashing;

import com.google.common.hash.HashCode;
import com.google.common.io.BaseEncoding;
import java.util.Arrays;

/**
 * An opaque fingerprint of file content. Two hashes are equal iff their bytes are equal, which the
 * coordinator takes to mean the content was identical when both were computed.
 */
public final class ContentHash {
  private final byte[] value;

  public static ContentHash fromBytes(byte[] value) {
    return new ContentHash(Arrays.copyOf(value, value.length));
  }

  public static ContentHash fromHashCode(HashCode hashCode) {
    return new ContentHash(hashCode.asBytes());
  }

  /** Parses the form produced by {@link #asString()}. */
  public static ContentHash fromString(String hex) {
    return new ContentHash(BaseEncoding.base16().lowerCase().decode(hex));
  }

  private ContentHash(byte[] value) {
    this.value = value;
  }

  /** @return a copy of the fingerprint bytes. */
  public byte[] asBytes() {
    return Arrays.copyOf(value, value.length);
  }

  /** @return the fingerprint as lower-case hex. */
  public String asString() {
    return BaseEncoding.base16().lowerCase().encode(value);
  }

  public int sizeInBytes() {
    return value.length;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    ContentHash that = (ContentHash) o;
    return Arrays.equals(value, that.value);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(value);
  }

  @Override
  public String toString() {
    return asString();
  }
}
