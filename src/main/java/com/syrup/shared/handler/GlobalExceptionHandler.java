package com.syrup.shared.handler;

import com.syrup.shared.dto.ErrorResponse;
import com.syrup.shared.exception.AgentNotFoundException;
import com.syrup.shared.exception.InvalidCredentialsException;
import com.syrup.shared.exception.UnsupportedPlatformException;
import com.syrup.shared.exception.UnsupportedProviderException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * 全域例外處理
 *
 * 只有「建構期」錯誤（不支援的平台 / 供應商、憑證錯誤）會以例外形式到這裡，
 * 交易失敗一律是正常的 TradeResult(status=failed)，不會走到這裡。
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler({
            UnsupportedPlatformException.class,
            UnsupportedProviderException.class,
            InvalidCredentialsException.class
    })
    public ResponseEntity<ErrorResponse> handleConstruction(RuntimeException e) {
        log.warn("建構失敗: {}", e.getMessage());
        return ResponseEntity.badRequest()
                .body(new ErrorResponse("建構失敗", e.getMessage()));
    }

    @ExceptionHandler(AgentNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleAgentNotFound(AgentNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(new ErrorResponse("找不到 agent", e.getMessage()));
    }

    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class
    })
    public ResponseEntity<ErrorResponse> handleUnreadable(Exception e) {
        // 通常是 platform / trade_type 等列舉值不合法，或必要欄位缺漏
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return ResponseEntity.badRequest()
                .body(new ErrorResponse("請求格式錯誤", root.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .reduce((a, b) -> a + "; " + b)
                .orElse("參數驗證失敗");
        return ResponseEntity.badRequest()
                .body(new ErrorResponse("參數驗證失敗", message));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception e) {
        log.error("未預期的錯誤: {}", e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("伺服器錯誤", e.getMessage()));
    }
}
