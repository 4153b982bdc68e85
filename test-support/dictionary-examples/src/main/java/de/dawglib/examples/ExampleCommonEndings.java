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
 * Words with distinct first letters but identical endings. All of "b", "c" and "d" lead to the same state, and the
 * accepting leaves of all words collapse into one.
 */
public class ExampleCommonEndings extends DefaultDictionaryExample {

    public ExampleCommonEndings() {
        // root, {ing, ings}, {ng, ngs}, {g, gs}, {"", s}, {""}
        super(Arrays.asList("bing", "bings", "cing", "cings", "ding", "dings"),
              Arrays.asList("ing", "bin", "bingss", "eing"),
              6);
    }

    public static ExampleCommonEndings createExample() {
        return new ExampleCommonEndings();
    }
}
