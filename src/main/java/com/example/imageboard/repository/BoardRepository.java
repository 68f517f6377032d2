package com.example.imageboard.repository;

import com.example.imageboard.entity.Board;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface BoardRepository extends JpaRepository<Board, Long> {
    // 根据 URL 短名查找版块
    Optional<Board> findByName(String name);

    // 创建版块前判断是否重名
    boolean existsByName(String name);

    // 首页展示用，按短名排序
    List<Board> findAllByOrderByNameAsc();
}
