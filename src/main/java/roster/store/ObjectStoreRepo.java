/**
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package roster.store;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;

/**
 * The handful of primitives needed from a shared object store: one namespace
 * (container) holding named records. Implementations must be safe for
 * concurrent use by several threads and several processes against the same
 * namespace. Creating a record that does not exist yet must be atomic per
 * record name.
 * 
 * Any unexpected backend response is reported as an {@link IOException}. A
 * record that already exists is not an error: it is reported through
 * {@link CreateResult#ALREADY_EXISTS}.
 */
public interface ObjectStoreRepo extends Closeable {

  /**
   * Creates the namespace unless it already exists.
   * 
   * @throws IOException
   *           if the namespace could not be ensured
   */
  public void ensureNamespace() throws IOException;

  /**
   * Lists the names of every record currently in the namespace. No ordering
   * is implied.
   * 
   * @return the record names
   * @throws IOException
   *           on a backend fault
   */
  public List<String> listRecordNames() throws IOException;

  /**
   * Writes a record.
   * 
   * @param name
   *          the record name
   * @param content
   *          the record content
   * @param overwrite
   *          when false an existing record is left alone and
   *          {@link CreateResult#ALREADY_EXISTS} is returned
   * @return whether the record was written
   * @throws IOException
   *           on a backend fault
   */
  public CreateResult createRecord(String name, byte[] content, boolean overwrite) throws IOException;

  /**
   * Deletes a record. Deleting a record that does not exist is not an error.
   * 
   * @param name
   *          the record name
   * @param includeDerived
   *          also delete artifacts derived from the record (snapshots, child
   *          nodes); without it a record that has any fails to delete
   * @throws IOException
   *           on a backend fault
   */
  public void deleteRecord(String name, boolean includeDerived) throws IOException;

}
