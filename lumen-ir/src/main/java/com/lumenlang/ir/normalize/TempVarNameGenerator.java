package com.lumenlang.ir.normalize;

import com.lumenlang.compiler.ast.LocalVar;
import com.lumenlang.compiler.types.LumenType;
import com.lumenlang.ir.InternalInvariantException;

import java.util.HashSet;
import java.util.Set;

/**
 * 一次规范化运行内的临时变量分配器。
 * <p>
 * id 从 {@link LocalVar#TEMP_ID_BASE} 起递增，与前端变量 id 不相交；名字由 id 派生。
 */
public final class TempVarNameGenerator {

    private int nextId = LocalVar.TEMP_ID_BASE;
    private final Set<Integer> issued = new HashSet<>();

    /**
     * 分配一个新的临时变量。
     */
    public LocalVar fresh(LumenType type) {
        int id = nextId++;
        if (id < LocalVar.TEMP_ID_BASE) {
            throw new InternalInvariantException("Temp id space exhausted");
        }
        if (!issued.add(id)) {
            throw new InternalInvariantException("Temp id allocated twice: " + id);
        }
        return LocalVar.temp(id, type);
    }

    /**
     * 声明一个输入中已存在的临时变量，之后分配的 id 都大于它。
     */
    public void reserve(LocalVar existing) {
        if (!existing.isTemp()) {
            throw new IllegalArgumentException("Not a temp variable: " + existing);
        }
        if (!issued.add(existing.getId())) {
            throw new InternalInvariantException("Temp declared twice: " + existing.getName());
        }
        nextId = Math.max(nextId, existing.getId() + 1);
    }

    public int getIssuedCount() {
        return issued.size();
    }
}
