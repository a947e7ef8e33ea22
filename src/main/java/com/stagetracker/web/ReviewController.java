package com.stagetracker.web;

import com.stagetracker.config.ApplicationShutdown;
import com.stagetracker.core.ItemLookupService;
import com.stagetracker.core.MoveRequestQueue;
import com.stagetracker.core.StageIndex;
import com.stagetracker.model.Item;
import com.stagetracker.model.MoveRequest;
import com.stagetracker.model.Stage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Controller;
import org.springframework.ui.Model;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.ResponseBody;

/**
 * Pages for reviewing items: list what is pending, view one item, and
 * accept or reject it.
 * <p>
 * Accept and reject only enqueue the move and redirect straight away to
 * another pending item. Because the move is applied asynchronously, that
 * item can be the one just decided; its view then reports it as gone.
 */
@Slf4j
@Controller
@RequiredArgsConstructor
public class ReviewController {
    private final StageIndex stageIndex;
    private final ItemLookupService lookupService;
    private final MoveRequestQueue moveQueue;
    private final ApplicationShutdown shutdown;

    @GetMapping("/")
    public String index(Model model) {
        model.addAttribute("pending", stageIndex.snapshot(Stage.REVIEW).asList());
        model.addAttribute("acceptedCount", stageIndex.size(Stage.ACCEPT));
        model.addAttribute("rejectedCount", stageIndex.size(Stage.REJECT));
        return "index";
    }

    @GetMapping("/view/{id:[0-9]+}")
    public String view(@PathVariable long id, Model model) {
        Item item = lookupService.load(id, Stage.REVIEW);
        model.addAttribute("item", item);
        return "view";
    }

    @RequestMapping(value = "/accept/{id:[0-9]+}", method = {RequestMethod.GET, RequestMethod.POST})
    public String accept(@PathVariable long id) {
        return decide(id, Stage.ACCEPT);
    }

    @RequestMapping(value = "/reject/{id:[0-9]+}", method = {RequestMethod.GET, RequestMethod.POST})
    public String reject(@PathVariable long id) {
        return decide(id, Stage.REJECT);
    }

    @GetMapping("/exit")
    @ResponseBody
    public String exit() {
        shutdown.request();
        return "Terminating server...";
    }

    private String decide(long id, Stage destination) {
        moveQueue.submit(MoveRequest.fromReview(id, destination));
        return lookupService.nextForReview()
                .map(next -> "redirect:/view/" + next)
                .orElse("redirect:/");
    }
}
