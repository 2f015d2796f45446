package com.jimin.digest.ingest;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 커뮤니티 게시글 (Reddit 등)
 */
public record CommunityPost(String title,
                            String url,
                            String community,
                            String author,
                            LocalDateTime postedAt,
                            String body,
                            long upvotes,
                            long comments,
                            List<String> topics) implements RawItem {
}
