/** Cross-cutting helpers shared by the use cases. */
package com.polyglot.application.support;
