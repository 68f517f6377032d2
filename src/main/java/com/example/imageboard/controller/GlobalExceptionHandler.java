package com.example.imageboard.controller;

import com.example.imageboard.exception.NotFoundException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.TypeMismatchException;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.servlet.ModelAndView;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * 全局异常处理
 * 版块/主题帖不存在 -> 404 页面；上传超过 5MB -> 413 页面；其余异常 -> 通用 500 页面，不暴露任何细节。
 */
@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler({NotFoundException.class, NoResourceFoundException.class})
    public ModelAndView notFound(Exception e) {
        log.debug("Not found: {}", e.getMessage());
        return errorPage("error/404", HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ModelAndView uploadTooLarge(MaxUploadSizeExceededException e) {
        log.info("Rejected oversized request: {}", e.getMessage());
        return errorPage("error/413", HttpStatus.PAYLOAD_TOO_LARGE);
    }

    @ExceptionHandler({TypeMismatchException.class, MissingServletRequestParameterException.class})
    public ModelAndView badRequest(Exception e) {
        log.debug("Bad request: {}", e.getMessage());
        return errorPage("error/400", HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(Exception.class)
    public ModelAndView serverError(Exception e, HttpServletRequest request) {
        // Spring MVC 自带的异常 (405 等) 保留原本的状态码
        if (e instanceof ErrorResponse) {
            HttpStatusCode status = ((ErrorResponse) e).getStatusCode();
            if (status.is4xxClientError()) {
                return errorPage("error/400", status);
            }
        }
        log.error("Unhandled error on {} {}", request.getMethod(), request.getRequestURI(), e);
        return errorPage("error/500", HttpStatus.INTERNAL_SERVER_ERROR);
    }

    private ModelAndView errorPage(String view, HttpStatusCode status) {
        ModelAndView mav = new ModelAndView(view);
        mav.setStatus(status);
        return mav;
    }
}
