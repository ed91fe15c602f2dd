package com.lumenlang.ir.backend;

/**
 * 生成代码引用的运行时辅助函数与哨兵值名称。运行时库本身不由本模块生成。
 */
public final class LuaRuntime {

    /** 位运算库，提供 band/bor/bxor/lshift/arshift/rshift/bnot */
    public static final String BIT = "_hx_bit";
    /** 方法闭包绑定：_hx_bind(o, o.m) */
    public static final String BIND = "_hx_bind";
    /** 0 起始数组：_hx_tab_array({[0]=a, b}, n) */
    public static final String TAB_ARRAY = "_hx_tab_array";
    /** 匿名对象：_hx_o({__fields__={...}, ...}) */
    public static final String OBJECT = "_hx_o";
    /** 空表构造 */
    public static final String EMPTY = "_hx_e";
    /** 按原型分配实例 */
    public static final String NEW = "_hx_new";
    /** 带类型检查的转换 */
    public static final String CAST = "_hx_cast";
    /** pcall 体正常结束时返回的哨兵 */
    public static final String PCALL_DEFAULT = "_hx_pcall_default";
    /** pcall 体内 break 外层循环时返回的哨兵 */
    public static final String PCALL_BREAK = "_hx_pcall_break";
    /** pcall 体内 continue 外层循环时返回的哨兵 */
    public static final String PCALL_CONTINUE = "_hx_pcall_continue";
    /** 任意值转字符串 */
    public static final String STD_STRING = "Std.string";

    public static final String PCALL_STATUS = "_hx_status";
    public static final String PCALL_RESULT = "_hx_result";

    private LuaRuntime() {
    }
}
