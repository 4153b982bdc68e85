/* Copyright (C) 2013-2023 TU Dortmund
 * This file is part of DawgLib.
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
package de.dawglib.examples;

import java.util.Arrays;

/**
 * Every word is a prefix of the next one, so no two states can be merged.
 */
public class ExampleNestedPrefixes extends DefaultDictionaryExample {

    public ExampleNestedPrefixes() {
        super(Arrays.asList("a", "ab", "abc", "abcd"), Arrays.asList("", "b", "abd", "abcde"), 5);
    }

    public static ExampleNestedPrefixes createExample() {
        return new ExampleNestedPrefixes();
    }
}
