/*
 * Copyright © 2025 ANEO (armonik@aneo.fr)
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
package fr.aneo.datalake.client.acl;

/**
 * Receives one {@link AccessControlChanges} per successful batch, in batch order.
 * <p>
 * Invoked synchronously before the next batch is requested. An exception thrown from the
 * listener aborts the recursive change and is surfaced to the caller.
 */
@FunctionalInterface
public interface AccessControlChangeListener {
  void onBatch(AccessControlChanges changes);
}
