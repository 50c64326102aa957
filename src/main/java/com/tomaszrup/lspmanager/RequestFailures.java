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
package com.tomaszrup.lspmanager;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import com.tomaszrup.lspmanager.project.ProjectKey;

/**
 * Helpers for turning whatever a request pipeline failed with into a
 * {@link LanguageServerException} and for logging it on one line.
 */
public final class RequestFailures {

    private RequestFailures() {
    }

    public static String summarize(Throwable throwable) {
        if (throwable == null) {
            return "<null>";
        }
        String message = throwable.getMessage();
        if (message == null || message.isBlank()) {
            return throwable.getClass().getName();
        }
        return throwable.getClass().getSimpleName() + ": " + message;
    }

    public static Throwable unwrap(Throwable throwable) {
        Throwable current = throwable;
        while (current instanceof CompletionException || current instanceof ExecutionException) {
            Throwable cause = current.getCause();
            if (cause == null) {
                break;
            }
            current = cause;
        }
        return current;
    }

    public static boolean isFatal(Throwable throwable) {
        return throwable instanceof VirtualMachineError;
    }

    /**
     * Unwraps and converts. {@link LanguageServerException} passes through,
     * fatal errors are rethrown and anything else becomes {@code fallback}.
     */
    public static LanguageServerException toLanguageServerException(Throwable throwable, ProjectKey key,
            LanguageServerException.Kind fallback) {
        Throwable root = unwrap(throwable);
        if (root instanceof LanguageServerException) {
            return (LanguageServerException) root;
        }
        if (isFatal(root)) {
            throw (Error) root;
        }
        return new LanguageServerException(fallback, key, summarize(root), root);
    }
}
