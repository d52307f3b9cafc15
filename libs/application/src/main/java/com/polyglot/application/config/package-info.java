/** Configuration records bound by the hosting application. */
package com.polyglot.application.config;
