package com.lumenlang.compiler.ast.expr;

import com.lumenlang.compiler.ast.SourceLocation;
import com.lumenlang.compiler.ast.TypedNode;
import com.lumenlang.compiler.ast.TypedNodeVisitor;
import com.lumenlang.compiler.types.LumenType;

import java.util.ArrayList;
import java.util.List;

/**
 * 匿名对象字面量，字段按声明顺序求值。
 */
public final class ObjectLiteralExpr extends TypedNode {

    private final List<Field> fields;

    public ObjectLiteralExpr(SourceLocation location, LumenType type, List<Field> fields) {
        super(location, type);
        this.fields = fields;
    }

    public List<Field> getFields() {
        return fields;
    }

    public List<TypedNode> getValues() {
        List<TypedNode> values = new ArrayList<>(fields.size());
        for (Field f : fields) values.add(f.getValue());
        return values;
    }

    /**
     * 按原有字段名构造新的字面量。
     */
    public ObjectLiteralExpr withValues(List<TypedNode> values) {
        List<Field> result = new ArrayList<>(fields.size());
        for (int i = 0; i < fields.size(); i++) {
            result.add(new Field(fields.get(i).getName(), values.get(i)));
        }
        return new ObjectLiteralExpr(location, type, result);
    }

    @Override
    public String getTag() {
        return "object";
    }

    @Override
    public <R, C> R accept(TypedNodeVisitor<R, C> visitor, C context) {
        return visitor.visitObjectLiteral(this, context);
    }

    public static final class Field {
        private final String name;
        private final TypedNode value;

        public Field(String name, TypedNode value) {
            this.name = name;
            this.value = value;
        }

        public String getName() {
            return name;
        }

        public TypedNode getValue() {
            return value;
        }
    }
}
