package xyz.vvrf.reactor.agent.tutor;

import lombok.Value;

/**
 * 学习材料中的一段文本。
 *
 * @author ruifeng.wen
 */
@Value
public class ContentPassage {
    String contentId;
    String title;
    String text;
}
