/*
 * Copyright 2025 The AssertKit Authors
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

/**
 * Small assertion helpers for tests: {@link io.assertkit.AssertKit AssertKit} with aborting error checks,
 * continuing deep-equality and substring checks, and temporary file creation, all reporting to an
 * {@link io.assertkit.AssertReporter AssertReporter} and printing the {@link io.assertkit.CallerLocation
 * CallerLocation} of the failing call. {@link io.assertkit.DeepEquals DeepEquals} is the structural equality used.
 */
package io.assertkit;
