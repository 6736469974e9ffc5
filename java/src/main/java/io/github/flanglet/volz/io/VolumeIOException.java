/*
Copyright 2011-2025 Frederic Langlet
Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
you may obtain a copy of the License at

                http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/

package io.github.flanglet.volz.io;


/**
 * I/O exception carrying one of the {@link io.github.flanglet.volz.Error}
 * codes. Container format errors, truncated input, integrity failures and
 * failed chunk tasks are all reported with this type; the code tells them
 * apart.
 */
public class VolumeIOException extends java.io.IOException {
    private static final long serialVersionUID = 4725081950433516812L;

    private final int code;

    /**
     * Constructs a new {@code VolumeIOException} with the specified detail
     * message and error code.
     *
     * @param msg the detail message
     * @param code the error code
     */
    public VolumeIOException(String msg, int code) {
        super(msg);
        this.code = code;
    }

    /**
     * Constructs a new {@code VolumeIOException} wrapping the original cause.
     *
     * @param msg the detail message
     * @param cause the original cause
     * @param code the error code
     */
    public VolumeIOException(String msg, Throwable cause, int code) {
        super(msg, cause);
        this.code = code;
    }

    public int getErrorCode() {
        return this.code;
    }
}
