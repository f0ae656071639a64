/**
 * Compiles and runs user scriptlets (function bodies and boolean conditions) on an embedded
 * Rhino engine with best-effort isolation. Invocation always returns a future; values cross the
 * boundary as JSON. Results can be reused from a bounded cache keyed by code and input.
 */
package com.nodeflow.scriptlet;
