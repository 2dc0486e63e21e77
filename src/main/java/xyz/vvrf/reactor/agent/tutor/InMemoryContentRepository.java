package xyz.vvrf.reactor.agent.tutor;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;

import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 基于内存的 ContentRepository，用于开发和测试。
 *
 * @author ruifeng.wen
 */
@Slf4j
public class InMemoryContentRepository implements ContentRepository {

    private final Map<String, ContentPassage> passages = new ConcurrentHashMap<>();

    public void save(ContentPassage passage) {
        Objects.requireNonNull(passage, "材料段落不能为空");
        passages.put(passage.getContentId(), passage);
        log.debug("已保存材料 '{}'", passage.getContentId());
    }

    @Override
    public Flux<ContentPassage> findByIds(Collection<String> contentIds) {
        if (contentIds == null || contentIds.isEmpty()) {
            return Flux.empty();
        }
        return Flux.fromIterable(contentIds)
                .distinct()
                .mapNotNull(passages::get);
    }
}
