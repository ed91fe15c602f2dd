package com.lumenlang.compiler.types;

import com.lumenlang.compiler.ast.TypePath;

import java.util.Collections;
import java.util.List;

/**
 * 类实例类型（包含泛型参数，泛型在后端只作展示用途）。
 */
public class ClassType extends LumenType {

    private final TypePath path;
    private final List<LumenType> typeArgs;

    public ClassType(TypePath path, List<LumenType> typeArgs, boolean nullable) {
        super(nullable);
        this.path = path;
        this.typeArgs = typeArgs != null ? typeArgs : Collections.<LumenType>emptyList();
    }

    public ClassType(TypePath path, boolean nullable) {
        this(path, Collections.<LumenType>emptyList(), nullable);
    }

    public ClassType(TypePath path) {
        this(path, Collections.<LumenType>emptyList(), false);
    }

    public TypePath getPath() {
        return path;
    }

    public List<LumenType> getTypeArgs() {
        return typeArgs;
    }

    @Override
    public LumenType withNullable(boolean nullable) {
        return new ClassType(path, typeArgs, nullable);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(path.toString());
        if (!typeArgs.isEmpty()) {
            sb.append('<');
            for (int i = 0; i < typeArgs.size(); i++) {
                if (i > 0) sb.append(", ");
                sb.append(typeArgs.get(i));
            }
            sb.append('>');
        }
        if (nullable) sb.append('?');
        return sb.toString();
    }
}
