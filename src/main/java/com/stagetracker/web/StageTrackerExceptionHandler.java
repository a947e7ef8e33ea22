package com.stagetracker.web;

import com.stagetracker.core.ItemNotFoundException;
import com.stagetracker.core.ItemReadException;
import com.stagetracker.core.MoveRejectedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.servlet.ModelAndView;

/**
 * Turns lookup and queue failures into user-facing pages
 */
@Slf4j
@ControllerAdvice
public class StageTrackerExceptionHandler {

    @ExceptionHandler(ItemNotFoundException.class)
    public ModelAndView handleNotFound(ItemNotFoundException ex) {
        log.info("Load failed: ID: {} [{}]", ex.getItemId(), ex.getMessage());
        return problem(HttpStatus.NOT_FOUND, "Item " + ex.getItemId() + " is not available for review");
    }

    @ExceptionHandler(ItemReadException.class)
    public ModelAndView handleReadFailure(ItemReadException ex) {
        log.warn("Load failed: ID: {}", ex.getItemId(), ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Item " + ex.getItemId() + " could not be read, try again");
    }

    @ExceptionHandler(MoveRejectedException.class)
    public ModelAndView handleMoveRejected(MoveRejectedException ex) {
        log.warn("Move rejected: {}", ex.getMessage());
        return problem(HttpStatus.SERVICE_UNAVAILABLE, "Server is shutting down, decision not recorded");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ModelAndView handleBadRequest(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, ex.getMessage());
    }

    private ModelAndView problem(HttpStatus status, String message) {
        ModelAndView mav = new ModelAndView("problem");
        mav.setStatus(status);
        mav.addObject("status", status.value());
        mav.addObject("message", message);
        return mav;
    }
}
