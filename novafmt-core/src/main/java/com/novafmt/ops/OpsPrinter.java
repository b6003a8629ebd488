package com.novafmt.ops;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import java.util.List;

/**
 * 把指令流序列化为 JSON，用于调试排版结果
 */
public final class OpsPrinter {
    private final Gson gson = new GsonBuilder().serializeNulls().setPrettyPrinting().create();

    public String toJson(List<Op> ops) {
        return gson.toJson(toJsonArray(ops));
    }

    public JsonArray toJsonArray(List<Op> ops) {
        JsonArray array = new JsonArray();
        for (Op op : ops) {
            array.add(toJsonObject(op));
        }
        return array;
    }

    private JsonObject toJsonObject(Op op) {
        JsonObject item = new JsonObject();
        item.addProperty("op", op.getKind().name());
        switch (op.getKind()) {
            case LITERAL: {
                LiteralOp literal = (LiteralOp) op;
                item.addProperty("text", literal.getText());
                item.addProperty("synthetic", literal.getToken() == null);
                break;
            }
            case TOKEN_ANCHOR: {
                TokenAnchorOp anchor = (TokenAnchorOp) op;
                item.addProperty("start", anchor.getStart());
                item.addProperty("end", anchor.getEnd());
                break;
            }
            case OPEN_GROUP:
                item.addProperty("id", ((OpenGroupOp) op).getId());
                item.addProperty("fill", ((OpenGroupOp) op).isFill());
                break;
            case CLOSE_GROUP:
                item.addProperty("id", ((CloseGroupOp) op).getId());
                break;
            case BREAK: {
                BreakOp breakOp = (BreakOp) op;
                item.addProperty("kind", breakOp.getBreakKind().name());
                item.addProperty("flatText", breakOp.getFlatText());
                item.addProperty("flexible", breakOp.isFlexible());
                item.addProperty("blankLines", breakOp.getBlankLines());
                break;
            }
            case INDENT:
                item.addProperty("amount", ((IndentOp) op).getAmount());
                break;
            default:
                break;
        }
        return item;
    }
}
