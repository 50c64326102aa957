////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.lspmanager.jsonrpc;

import java.io.IOException;

/**
 * Raised when the length-prefixed message stream can no longer be trusted:
 * an unparseable header block, a missing or invalid {@code Content-Length},
 * a body that is not a JSON object, or a stream that ends mid-frame.
 * There is no resynchronization after a fault.
 */
public class FramingFaultException extends IOException {

    private static final long serialVersionUID = 1L;

    public FramingFaultException(String message) {
        super(message);
    }

    public FramingFaultException(String message, Throwable cause) {
        super(message, cause);
    }
}
