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

package io.github.flanglet.volz;


/**
 * Unchecked exception raised by a chunk transform when its input cannot be
 * decoded. The error code is one of the {@link Error} constants.
 */
public class TransformException extends RuntimeException {

    private static final long serialVersionUID = 3160477263805123341L;

    private final int code;


    public TransformException(String message, int code) {
        super(message);
        this.code = code;
    }


    public TransformException(String message, Throwable cause, int code) {
        super(message, cause);
        this.code = code;
    }


    public int getErrorCode() {
        return this.code;
    }
}
