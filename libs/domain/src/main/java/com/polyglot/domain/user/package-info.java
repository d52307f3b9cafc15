/** The learner aggregate. */
package com.polyglot.domain.user;
