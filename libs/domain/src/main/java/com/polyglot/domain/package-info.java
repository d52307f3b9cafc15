/**
 * Tutoring domain model. No framework, persistence or transport types are allowed here.
 */
package com.polyglot.domain;
