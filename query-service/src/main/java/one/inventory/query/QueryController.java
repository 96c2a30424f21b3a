package one.inventory.query;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class QueryController {

    private final QueryOrchestrator queryOrchestrator;

    /**
     * 处理自然语言库存查询，例如 "I sold 3 t shirts"、"How many pants do I have?"
     */
    @PostMapping("/process_query")
    public QueryResponse processQuery(@Valid @RequestBody QueryRequest request) {
        return queryOrchestrator.process(request.getQuery());
    }
}
