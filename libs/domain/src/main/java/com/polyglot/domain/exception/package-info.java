/**
 * Exception taxonomy of the tutoring core.
 *
 * <p>Every exception extends {@link com.polyglot.domain.exception.TutoringException} and reports one
 * {@link com.polyglot.domain.exception.ErrorKind}. No framework or transport type appears here.
 */
package com.polyglot.domain.exception;
