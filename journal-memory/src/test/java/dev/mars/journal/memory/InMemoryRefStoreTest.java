package dev.mars.journal.memory;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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

import dev.mars.journal.api.RefStore;
import dev.mars.journal.test.RefStoreContractTest;
import dev.mars.journal.test.TestCategories;
import org.junit.jupiter.api.Tag;

@Tag(TestCategories.CORE)
class InMemoryRefStoreTest extends RefStoreContractTest {

    @Override
    protected RefStore createRefStore() {
        return new InMemoryRefStore();
    }
}
