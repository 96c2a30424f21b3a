package one.inventory.query;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 语言模型解析出的意图
 *
 * 只做结构校验，item / change 是否合理交给库存服务判断
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class InterpretedIntent {

    /**
     * 操作类型：GET 查询，POST 修改
     */
    private String operation;

    /**
     * 商品名称，查询全部库存时为空
     */
    private String item;

    /**
     * 库存变化量，查询时为空
     */
    private Integer change;

    /**
     * 语言模型给出的判断理由
     */
    private String reasoning;

    public IntentOperation operationKind() {
        return IntentOperation.of(operation);
    }
}
