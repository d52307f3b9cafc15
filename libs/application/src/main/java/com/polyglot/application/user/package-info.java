/** Learner registration, proficiency and summary use cases. */
package com.polyglot.application.user;
