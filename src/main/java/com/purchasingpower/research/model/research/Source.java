package com.purchasingpower.research.model.research;

import com.google.common.base.Preconditions;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A fetched page whose readable text is non-empty.
 */
@Value
public class Source {
    String url;
    String title;
    String content;
    Instant fetchTime;

    @Builder
    public Source(String url, String title, String content, Instant fetchTime) {
        Preconditions.checkArgument(url != null && !url.isBlank(), "Source url must not be blank");
        Preconditions.checkArgument(content != null && !content.isBlank(),
                "Source content must not be blank: %s", url);
        this.url = url;
        this.title = title == null ? "" : title;
        this.content = content;
        this.fetchTime = fetchTime;
    }
}
