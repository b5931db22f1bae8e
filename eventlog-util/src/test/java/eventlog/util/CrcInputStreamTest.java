/*
 * Copyright 2014 WANdisco
 *
 *  WANdisco licenses this file to you under the Apache License,
 *  version 2.0 (the "License"); you may not use this file except in compliance
 *  with the License. You may obtain a copy of the License at:
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS, WITHOUT
 *  WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied. See the
 *  License for the specific language governing permissions and limitations
 *  under the License.
 */

package eventlog.util;

import com.google.common.io.ByteStreams;
import org.junit.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.zip.Adler32;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;

public class CrcInputStreamTest {
  private static final byte[] CONTENT = "sections of notifications".getBytes(StandardCharsets.UTF_8);

  @Test
  public void computesTheSameChecksumAsTheUnderlyingAlgorithmOverTheBytesRead() throws Exception {
    Adler32 expected = new Adler32();
    expected.update(CONTENT, 0, CONTENT.length);

    CrcInputStream crcStream = new CrcInputStream(new ByteArrayInputStream(CONTENT), new Adler32());
    crcStream.read();
    ByteStreams.toByteArray(crcStream);

    assertThat(crcStream.getValue(), is(equalTo(expected.getValue())));
  }

  @Test
  public void doesNotChecksumTheEndOfStreamMarker() throws Exception {
    Adler32 expected = new Adler32();
    expected.update(CONTENT, 0, CONTENT.length);

    CrcInputStream crcStream = new CrcInputStream(new ByteArrayInputStream(CONTENT), new Adler32());
    ByteStreams.toByteArray(crcStream);
    assertThat(crcStream.read(), is(equalTo(-1)));

    assertThat(crcStream.getValue(), is(equalTo(expected.getValue())));
  }
}
