package com.example.imageboard.controller;

import com.example.imageboard.entity.Board;
import com.example.imageboard.entity.BoardThread;
import com.example.imageboard.exception.ConflictException;
import com.example.imageboard.exception.NotFoundException;
import com.example.imageboard.exception.ValidationException;
import com.example.imageboard.repository.BoardRepository;
import com.example.imageboard.service.BoardService;
import com.example.imageboard.service.PostService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.servlet.mvc.support.RedirectAttributes;

/**
 * 管理控制器：创建/删除版块，主题帖置顶与锁帖
 * 注意：这里没有任何身份校验，部署时应放在受保护的网络或反向代理之后。
 */
@Controller
public class AdminController {

    @Autowired
    private BoardService boardService;
    @Autowired
    private PostService postService;
    @Autowired
    private BoardRepository boardRepository;

    @GetMapping("/admin/create_board")
    public String createBoardPage() {
        return "create_board";
    }

    @PostMapping("/admin/create_board")
    public String createBoard(@RequestParam(required = false) String name,
                              @RequestParam(required = false) String title,
                              @RequestParam(defaultValue = "") String description,
                              RedirectAttributes redirectAttributes) {
        try {
            Board board = boardService.createBoard(name, title, description);
            redirectAttributes.addFlashAttribute("flash", "Board created successfully");
            return BoardController.boardRedirect(board);
        } catch (ConflictException | ValidationException e) {
            redirectAttributes.addFlashAttribute("flash", e.getMessage());
            return "redirect:/admin/create_board";
        }
    }

    @PostMapping("/admin/boards/{board}/delete")
    public String deleteBoard(@PathVariable("board") String boardName, RedirectAttributes redirectAttributes) {
        Board board = boardService.getBoard(boardName);
        boardService.deleteBoard(board.getId());
        redirectAttributes.addFlashAttribute("flash", "Board /" + board.getName() + "/ deleted");
        return "redirect:/";
    }

    // ================== 主题帖管理标记 ==================

    @PostMapping("/admin/thread/{id}/pin")
    public String pin(@PathVariable("id") Long threadId, @RequestParam boolean value) {
        return threadRedirect(postService.setPinned(threadId, value));
    }

    @PostMapping("/admin/thread/{id}/lock")
    public String lock(@PathVariable("id") Long threadId, @RequestParam boolean value) {
        return threadRedirect(postService.setLocked(threadId, value));
    }

    private String threadRedirect(BoardThread thread) {
        Board board = boardRepository.findById(thread.getBoardId())
                .orElseThrow(() -> new NotFoundException("Board not found: " + thread.getBoardId()));
        return BoardController.threadRedirect(board, thread.getId());
    }
}
