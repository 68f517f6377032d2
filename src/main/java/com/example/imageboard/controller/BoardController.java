package com.example.imageboard.controller;

import com.example.imageboard.entity.Board;
import com.example.imageboard.exception.ThreadLockedException;
import com.example.imageboard.exception.ValidationException;
import com.example.imageboard.model.PostForm;
import com.example.imageboard.model.PostingResult;
import com.example.imageboard.model.StoredMedia;
import com.example.imageboard.model.ThreadPage;
import com.example.imageboard.model.ThreadView;
import com.example.imageboard.service.BoardService;
import com.example.imageboard.service.MediaStore;
import com.example.imageboard.service.PostService;
import com.example.imageboard.service.ThreadListingService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.servlet.ModelAndView;
import org.springframework.web.servlet.mvc.support.RedirectAttributes;

/**
 * 版块控制器：首页、版块列表、主题帖详情、发帖
 */
@Controller
public class BoardController {

    @Autowired
    private BoardService boardService;
    @Autowired
    private PostService postService;
    @Autowired
    private ThreadListingService listingService;
    @Autowired
    private MediaStore mediaStore; // 附件落盘与清理

    // ================== 1. 浏览 ==================

    @GetMapping("/")
    public ModelAndView index() {
        ModelAndView mav = new ModelAndView("index");
        mav.addObject("boards", boardService.listBoards());
        return mav;
    }

    /**
     * 版块列表页，?page= 从 1 开始，每页 10 个主题帖
     * page 不是数字时按第 1 页处理
     */
    @GetMapping({"/{board}", "/{board}/"})
    public ModelAndView boardView(@PathVariable("board") String boardName,
                                  @RequestParam(value = "page", required = false) String page) {
        Board board = boardService.getBoard(boardName);
        ThreadPage threads = listingService.listThreads(board.getId(), parsePage(page));

        ModelAndView mav = new ModelAndView("board");
        mav.addObject("board", board);
        mav.addObject("threads", threads);
        return mav;
    }

    @GetMapping("/{board}/thread/{id}")
    public ModelAndView threadView(@PathVariable("board") String boardName,
                                   @PathVariable("id") Long threadId,
                                   RedirectAttributes redirectAttributes) {
        Board board = boardService.getBoard(boardName);
        ThreadView view = postService.getThreadView(board, threadId);

        // 没有任何楼层的主题帖不展示，退回版块页
        if (view.getPosts().isEmpty()) {
            redirectAttributes.addFlashAttribute("flash", "Thread has no posts");
            return new ModelAndView(boardRedirect(board));
        }

        ModelAndView mav = new ModelAndView("thread");
        mav.addObject("board", view.getBoard());
        mav.addObject("thread", view.getThread());
        mav.addObject("posts", view.getPosts());
        return mav;
    }

    // ================== 2. 发帖 ==================

    /**
     * 发帖：表单没有 thread_id 时开新帖，否则回复该主题帖
     * 附件先落盘再写库；写库失败时删掉刚保存的附件，避免留下孤儿文件。
     */
    @PostMapping("/{board}/post")
    public String createPost(@PathVariable("board") String boardName,
                             @RequestParam(value = "name", required = false) String name,
                             @RequestParam(value = "email", required = false) String email,
                             @RequestParam(value = "subject", required = false) String subject,
                             @RequestParam(value = "comment", required = false) String comment,
                             @RequestParam(value = "thread_id", required = false) Long threadId,
                             @RequestParam(value = "file", required = false) MultipartFile file,
                             RedirectAttributes redirectAttributes) {
        Board board = boardService.getBoard(boardName);
        StoredMedia media = mediaStore.store(file).orElse(null);
        PostForm form = new PostForm(name, email, subject, comment, media);

        try {
            PostingResult result = threadId == null
                    ? postService.createThread(board.getId(), form)
                    : postService.appendPost(board.getId(), threadId, form);
            return threadRedirect(board, result.getThread().getId());
        } catch (ValidationException e) {
            mediaStore.discard(media);
            redirectAttributes.addFlashAttribute("flash", e.getMessage());
            return boardRedirect(board);
        } catch (ThreadLockedException e) {
            mediaStore.discard(media);
            redirectAttributes.addFlashAttribute("flash", e.getMessage());
            return threadRedirect(board, e.getThreadId());
        } catch (RuntimeException e) {
            mediaStore.discard(media);
            throw e;
        }
    }

    static int parsePage(String page) {
        if (page == null) {
            return 1;
        }
        try {
            return Integer.parseInt(page.trim());
        } catch (NumberFormatException e) {
            return 1;
        }
    }

    static String boardRedirect(Board board) {
        return "redirect:/" + board.getName() + "/";
    }

    static String threadRedirect(Board board, Long threadId) {
        return "redirect:/" + board.getName() + "/thread/" + threadId;
    }
}
