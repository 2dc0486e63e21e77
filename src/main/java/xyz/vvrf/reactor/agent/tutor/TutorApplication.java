package xyz.vvrf.reactor.agent.tutor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * 辅导服务入口。
 *
 * @author ruifeng.wen
 */
@SpringBootApplication(scanBasePackages = {"xyz.vvrf.reactor.agent.tutor", "xyz.vvrf.reactor.agent.web"})
public class TutorApplication {

    public static void main(String[] args) {
        SpringApplication.run(TutorApplication.class, args);
    }
}
