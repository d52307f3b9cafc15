package com.polyglot.application.vocabulary;

import com.polyglot.application.QueryHandler;
import com.polyglot.application.support.UseCaseLogContext;
import com.polyglot.domain.port.VocabularyRepository;
import com.polyglot.domain.vocabulary.ReviewSchedulingPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/** Vocabulary due for review at a given instant, soonest due first. */
public final class GetDueVocabularyHandler implements QueryHandler<GetDueVocabularyQuery, List<VocabularyReadModel>> {

    private static final Logger log = LoggerFactory.getLogger(GetDueVocabularyHandler.class);

    private final VocabularyRepository vocabulary;
    private final ReviewSchedulingPolicy policy;

    public GetDueVocabularyHandler(VocabularyRepository vocabulary, ReviewSchedulingPolicy policy) {
        this.vocabulary = vocabulary;
        this.policy = policy;
    }

    @Override
    public List<VocabularyReadModel> handle(GetDueVocabularyQuery query) {
        return UseCaseLogContext.call("GetDueVocabulary", query.userId(), null, () -> {
            List<VocabularyReadModel> due = vocabulary.listDue(query.userId(), query.asOf(), policy).stream()
                    .map(item -> VocabularyReadModel.of(item, item.schedule(policy)))
                    .toList();
            log.debug("{} vocabulary items due at {}", due.size(), query.asOf());
            return due;
        });
    }
}
