package com.newsdigest.pipeline.service.normalize;

import com.newsdigest.pipeline.dto.RawRecord;
import com.newsdigest.pipeline.dto.SourceDescriptor;
import com.newsdigest.pipeline.entity.SourceType;
import com.newsdigest.pipeline.exception.NormalizationException;

/**
 * Source-specific field extraction. One implementation per {@link SourceType}.
 */
public interface RecordNormalizer {

    SourceType supportedType();

    /**
     * @throws NormalizationException when the payload has the wrong shape
     */
    ExtractedArticle extract(RawRecord record, SourceDescriptor source);
}
