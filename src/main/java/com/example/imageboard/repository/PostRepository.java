package com.example.imageboard.repository;

import com.example.imageboard.entity.Post;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface PostRepository extends JpaRepository<Post, Long> {

    // 整个主题帖的全部楼层，按发帖时间正序
    List<Post> findByThreadIdOrderByCreatedAtAscPostNumberAsc(Long threadId);

    // 预览用：只取最早的几条，条数由 Pageable 决定
    @Query("""
           SELECT p FROM Post p
           WHERE p.threadId = :threadId
           ORDER BY p.createdAt ASC, p.postNumber ASC
           """)
    List<Post> findEarliest(@Param("threadId") Long threadId, Pageable pageable);

    long countByThreadId(Long threadId);

    // 当前最大楼层号，没有帖子时返回 null
    @Query("SELECT MAX(p.postNumber) FROM Post p WHERE p.threadId = :threadId")
    Integer findMaxPostNumber(@Param("threadId") Long threadId);

    @Modifying
    @Query("""
           DELETE FROM Post p
           WHERE p.threadId IN (SELECT t.id FROM BoardThread t WHERE t.boardId = :boardId)
           """)
    int deleteByBoardId(@Param("boardId") Long boardId);
}
