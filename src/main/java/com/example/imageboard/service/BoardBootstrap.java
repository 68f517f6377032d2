package com.example.imageboard.service;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * 启动时检查：库里一个版块都没有就写入默认版块
 */
@Component
public class BoardBootstrap implements ApplicationRunner {

    private final BoardService boardService;

    public BoardBootstrap(BoardService boardService) {
        this.boardService = boardService;
    }

    @Override
    public void run(ApplicationArguments args) {
        boardService.seedDefaultBoards();
    }
}
