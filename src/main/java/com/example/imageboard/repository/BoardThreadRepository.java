package com.example.imageboard.repository;

import com.example.imageboard.entity.BoardThread;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface BoardThreadRepository extends JpaRepository<BoardThread, Long> {

    // 版块列表分页：置顶优先，其次按顶帖时间倒序，id 倒序保证同一时刻的顺序稳定
    @Query(value = """
           SELECT t FROM BoardThread t
           WHERE t.boardId = :boardId
           ORDER BY t.pinned DESC, t.bumpedAt DESC, t.id DESC
           """,
           countQuery = "SELECT COUNT(t) FROM BoardThread t WHERE t.boardId = :boardId")
    Page<BoardThread> findListing(@Param("boardId") Long boardId, Pageable pageable);

    Optional<BoardThread> findByIdAndBoardId(Long id, Long boardId);

    long countByBoardId(Long boardId);

    /**
     * 回帖时加行级写锁 (SELECT ... FOR UPDATE)
     * 锁帖检查、楼层号计算、插入和顶帖都在这把锁下完成。
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM BoardThread t WHERE t.id = :id")
    Optional<BoardThread> findByIdForUpdate(@Param("id") Long id);

    @Modifying
    @Query("DELETE FROM BoardThread t WHERE t.boardId = :boardId")
    int deleteByBoardId(@Param("boardId") Long boardId);
}
