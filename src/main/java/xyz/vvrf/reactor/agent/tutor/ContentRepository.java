package xyz.vvrf.reactor.agent.tutor;

import reactor.core.publisher.Flux;

import java.util.Collection;

/**
 * 学习材料的只读访问。不假设具体的存储技术。
 *
 * @author ruifeng.wen
 */
public interface ContentRepository {

    /**
     * 按 ID 读取材料段落。不存在的 ID 被忽略。
     */
    Flux<ContentPassage> findByIds(Collection<String> contentIds);
}
