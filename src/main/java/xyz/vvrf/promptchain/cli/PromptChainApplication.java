package xyz.vvrf.promptchain.cli;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * 命令行入口：{@code prompt-chain <chain-file> <input-file> [--debug]}
 *
 * @author Refactored
 */
@SpringBootApplication
public class PromptChainApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(PromptChainApplication.class, args)));
    }
}
