package io.nosqlbench.nbpivot.config;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
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

/**
 * A pivot was requested with settings that cannot work, such as more than one numeric
 * binning column or an unknown aggregator. Raised before any row is processed.
 */
public class PivotConfigurationException extends RuntimeException {

    public PivotConfigurationException(String message) {
        super(message);
    }

    public PivotConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
