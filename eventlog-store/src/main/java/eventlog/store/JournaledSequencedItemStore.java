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

package eventlog.store;

import com.google.common.io.CountingInputStream;
import eventlog.EventLogConstants;
import eventlog.interfaces.store.SequencedItem;
import io.protostuff.ProtobufException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.Closeable;
import java.io.EOFException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * An in-memory store made durable by a write-ahead journal. Each atomic mutation is appended to
 * the journal as one checksummed record, and synced if so configured, before it becomes visible;
 * opening the store replays the journal.
 * <p>
 * A crash during an append can leave a partial record at the end of the journal. Recovery keeps
 * every complete record before it and truncates the rest. A journal whose very first record is
 * damaged is not truncated; opening it fails instead.
 */
public class JournaledSequencedItemStore extends InMemorySequencedItemStore implements Closeable {
  private static final Logger LOG = LoggerFactory.getLogger(JournaledSequencedItemStore.class);

  private final BytePersistence persistence;
  private final boolean syncOnWrite;
  private boolean journalBroken = false;

  private JournaledSequencedItemStore(BytePersistence persistence, boolean syncOnWrite) {
    this.persistence = persistence;
    this.syncOnWrite = syncOnWrite;
  }

  /**
   * Open, or create, the store journaled in the given directory. Every write is synced.
   */
  public static JournaledSequencedItemStore open(Path directory) throws IOException {
    Files.createDirectories(directory);
    return open(new FilePersistence(directory.resolve(EventLogConstants.JOURNAL_FILE_NAME)), true);
  }

  public static JournaledSequencedItemStore open(BytePersistence persistence, boolean syncOnWrite)
      throws IOException {
    final JournaledSequencedItemStore store = new JournaledSequencedItemStore(persistence, syncOnWrite);
    store.recover();
    return store;
  }

  @Override
  protected void beforeApply(List<SequencedItem> batch) throws IOException {
    if (journalBroken) {
      throw new IOException("Journal is unusable after a failed write could not be rolled back");
    }

    final long sizeBeforeWrite = persistence.size();
    try {
      persistence.append(JournalEncoding.encode(new JournalBatch(batch)));
      if (syncOnWrite) {
        persistence.sync();
      }
    } catch (IOException e) {
      rollBack(sizeBeforeWrite, e);
      throw e;
    }
  }

  @Override
  public void close() throws IOException {
    persistence.close();
  }

  private void recover() throws IOException {
    final long journalSize = persistence.size();
    long validLength = 0;
    int recordsRecovered = 0;

    try (CountingInputStream input = new CountingInputStream(
        new BufferedInputStream(persistence.getInputStream()))) {
      while (true) {
        try {
          applyRecovered(JournalEncoding.decode(input).toItems());
        } catch (EOFException e) {
          break;
        } catch (ProtobufException | JournalEncoding.CrcError e) {
          if (recordsRecovered == 0) {
            throw new IOException("The first journal record is damaged; refusing to truncate a journal of "
                + journalSize + " bytes with nothing recovered from it", e);
          }
          LOG.warn("Damaged journal record at byte {}: {}", validLength, e.getMessage());
          break;
        }
        validLength = input.getCount();
        recordsRecovered++;
      }
    }

    if (validLength < journalSize) {
      LOG.warn("Truncating journal from {} to {} bytes, discarding an incomplete or damaged tail",
          journalSize, validLength);
      persistence.truncate(validLength);
    }
    LOG.info("Recovered {} journal records ({} bytes)", recordsRecovered, validLength);
  }

  private void rollBack(long size, IOException writeFailure) {
    try {
      persistence.truncate(size);
    } catch (IOException | RuntimeException e) {
      writeFailure.addSuppressed(e);
      journalBroken = true;
      LOG.error("Unable to roll back a failed journal write; refusing further writes", e);
    }
  }
}
