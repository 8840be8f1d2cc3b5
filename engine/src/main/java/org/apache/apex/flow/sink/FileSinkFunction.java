/**
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
package org.apache.apex.flow.sink;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

import org.apache.apex.flow.api.Component;
import org.apache.apex.flow.api.Context.OperatorContext;
import org.apache.apex.flow.api.function.SinkFunction;

/**
 * Writes one line per record to a file.
 * <p>
 * Lines are buffered and flushed once the {@link OperatorContext#FLUSH_INTERVAL_MILLIS} interval elapsed
 * since the previous flush; an interval of 0 flushes after every record. Remaining lines are flushed when
 * the sink is torn down. With more than one instance the path names a directory holding one file per
 * instance, named after the instance number.
 *
 * @param <T> type of the records
 * @since 1.0.0
 */
public abstract class FileSinkFunction<T> implements SinkFunction<T>, Component<OperatorContext>
{
  private static final Logger LOG = LoggerFactory.getLogger(FileSinkFunction.class);
  private final String path;
  private transient BufferedWriter writer;
  private transient Path file;
  private transient long flushIntervalMillis;
  private transient long lastFlushMillis;

  protected FileSinkFunction(String path)
  {
    this.path = Preconditions.checkNotNull(path, "Path must not be null.");
  }

  public String getPath()
  {
    return path;
  }

  @Override
  public void setup(OperatorContext context)
  {
    Long interval = context.getValue(OperatorContext.FLUSH_INTERVAL_MILLIS);
    flushIntervalMillis = interval == null ? 0 : interval;
    Integer parallelism = context.getValue(OperatorContext.PARALLELISM);
    Path target = Paths.get(path);
    try {
      if (parallelism != null && parallelism > 1) {
        Files.createDirectories(target);
        target = target.resolve(String.valueOf(context.getInstanceIndex() + 1));
      } else if (target.getParent() != null) {
        Files.createDirectories(target.getParent());
      }
      writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8);
    } catch (IOException ex) {
      throw new RuntimeException("Cannot open " + target + " for writing", ex);
    }
    file = target;
    lastFlushMillis = System.currentTimeMillis();
    LOG.debug("Writing records to {}, flush interval {} ms", file, flushIntervalMillis);
  }

  @Override
  public void invoke(T record) throws IOException
  {
    writer.write(format(record));
    writer.newLine();
    long now = System.currentTimeMillis();
    if (flushIntervalMillis == 0 || now - lastFlushMillis >= flushIntervalMillis) {
      writer.flush();
      lastFlushMillis = now;
    }
  }

  @Override
  public void teardown()
  {
    if (writer != null) {
      try {
        writer.close();
      } catch (IOException ex) {
        throw new RuntimeException("Cannot close " + file, ex);
      } finally {
        writer = null;
      }
    }
  }

  /**
   * @param record the record
   * @return the line written for the record, without line separator
   */
  protected abstract String format(T record);

  @Override
  public String toString()
  {
    return getClass().getSimpleName() + "{" + path + "}";
  }

  private static final long serialVersionUID = 201810191402L;
}
