/** Vocabulary capture, review recording and due-vocabulary queries. */
package com.polyglot.application.vocabulary;
