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

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hashing;
import com.google.common.io.MoreFiles;
import java.io.IOException;
import java.nio.file.Path;

/**
 * A function from a regular file to a fingerprint of its bytes. The coordinator only calls this for
 * paths it has just seen as regular files, but the file may vanish or change while it is read.
 *
 * <p>Implementations throw {@link IOException} when the file cannot be read; use {@link
 * #compute(ContentHasher, Path)} to get every failure as a {@link ContentHashException}.
 */
@FunctionalInterface
public interface ContentHasher {
  ContentHasher MURMUR3_128 = streaming(Hashing.murmur3_128());

  ContentHasher SHA_256 = streaming(Hashing.sha256());

  ContentHasher DEFAULT_CONTENT_HASHER = MURMUR3_128;

  ContentHash hash(Path path) throws IOException;

  static ContentHasher streaming(HashFunction function) {
    return path -> ContentHash.fromHashCode(MoreFiles.asByteSource(path).hash(function));
  }

  /** @param name {@code murmur3_128} or {@code sha256} */
  static ContentHasher named(String name) {
    switch (name) {
      case "murmur3_128":
        return MURMUR3_128;
      case "sha256":
        return SHA_256;
      default:
        throw new IllegalArgumentException("Unknown hash algorithm: " + name);
    }
  }

  /** Runs {@code hasher}, reporting any failure as a typed {@link ContentHashException}. */
  static ContentHash compute(ContentHasher hasher, Path path) throws ContentHashException {
    ContentHash hash;
    try {
      hash = hasher.hash(path);
    } catch (ContentHashException e) {
      throw e;
    } catch (IOException e) {
      throw new ContentHashException(ContentHashException.Kind.IO, path, e);
    } catch (RuntimeException e) {
      throw new ContentHashException(ContentHashException.Kind.COMPUTATION, path, e);
    }
    if (hash == null) {
      throw new ContentHashException(ContentHashException.Kind.COMPUTATION, path, null);
    }
    return hash;
  }
}
