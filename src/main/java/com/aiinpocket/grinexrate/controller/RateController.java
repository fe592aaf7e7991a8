package com.aiinpocket.grinexrate.controller;

import com.aiinpocket.grinexrate.model.dto.RateQuote;
import com.aiinpocket.grinexrate.model.entity.RateRecord;
import com.aiinpocket.grinexrate.service.RateQuoteService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/api/rates")
@RequiredArgsConstructor
public class RateController {

    private final RateQuoteService rateQuoteService;

    /** 即時向 Grinex 取得報價並落庫 */
    @GetMapping
    public RateQuote getRates() {
        return rateQuoteService.getQuote();
    }

    /** 最近一次落庫的報價 */
    @GetMapping("/latest")
    public RateRecord latest() {
        return rateQuoteService.latestRate();
    }

    /**
     * 區間內的歷史報價（依落庫時間由新到舊）。
     * start / end 為 ISO-8601 時間，例如 2025-07-28T00:00:00Z。
     */
    @GetMapping("/history")
    public List<RateRecord> history(
            @RequestParam Instant start,
            @RequestParam Instant end) {
        return rateQuoteService.rateHistory(start, end);
    }
}
