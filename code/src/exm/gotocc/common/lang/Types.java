/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.gotocc.common.lang;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

import exm.gotocc.common.exceptions.GotoCCRuntimeError;

/**
 * C types as seen by the lowering stage.  Only the information needed to
 * allocate temporaries, insert casts and decide on addressability is kept.
 */
public class Types {

  public static final BoolType BOOL = new BoolType(false);
  public static final IntegerType CHAR = new IntegerType(8, true, false);
  public static final IntegerType INT = new IntegerType(32, true, false);
  public static final IntegerType UNSIGNED_INT = new IntegerType(32, false, false);
  public static final IntegerType LONG = new IntegerType(64, true, false);
  public static final EmptyType VOID = new EmptyType();

  public abstract static class Type {
    private final boolean isVolatile;

    protected Type(boolean isVolatile) {
      this.isVolatile = isVolatile;
    }

    public boolean isVolatile() {
      return isVolatile;
    }

    /**
     * @param volatileQualified
     * @return copy of this type with volatile qualifier set as given
     */
    public abstract Type withVolatile(boolean volatileQualified);

    /** Print out a short name for type, without qualifiers */
    public abstract String typeName();

    /** equals is required */
    @Override
    public abstract boolean equals(Object o);

    /** hashcode is required */
    @Override
    public abstract int hashCode();

    @Override
    public String toString() {
      return isVolatile ? "volatile " + typeName() : typeName();
    }
  }

  public static class BoolType extends Type {
    public BoolType(boolean isVolatile) {
      super(isVolatile);
    }

    @Override
    public BoolType withVolatile(boolean volatileQualified) {
      return new BoolType(volatileQualified);
    }

    @Override
    public String typeName() {
      return "_Bool";
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof BoolType &&
             ((BoolType)o).isVolatile() == isVolatile();
    }

    @Override
    public int hashCode() {
      return isVolatile() ? 3 : 2;
    }
  }

  public static class IntegerType extends Type {
    private final int width;
    private final boolean signed;

    public IntegerType(int width, boolean signed, boolean isVolatile) {
      super(isVolatile);
      assert(width > 0);
      this.width = width;
      this.signed = signed;
    }

    public int width() {
      return width;
    }

    public boolean isSigned() {
      return signed;
    }

    @Override
    public IntegerType withVolatile(boolean volatileQualified) {
      return new IntegerType(width, signed, volatileQualified);
    }

    @Override
    public String typeName() {
      String base;
      switch (width) {
        case 8:
          base = "char";
          break;
        case 16:
          base = "short";
          break;
        case 32:
          base = "int";
          break;
        case 64:
          base = "long";
          break;
        default:
          base = "__bv" + width;
      }
      return signed ? base : "unsigned " + base;
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof IntegerType)) {
        return false;
      }
      IntegerType other = (IntegerType)o;
      return width == other.width && signed == other.signed &&
             isVolatile() == other.isVolatile();
    }

    @Override
    public int hashCode() {
      return (width * 2 + (signed ? 1 : 0)) * 2 + (isVolatile() ? 1 : 0);
    }
  }

  /**
   * Type of a bit-field member.  Writes to bit-fields are read-modify-write
   * on the containing word.
   */
  public static class BitFieldType extends Type {
    private final Type underlying;
    private final int width;

    public BitFieldType(Type underlying, int width, boolean isVolatile) {
      super(isVolatile);
      this.underlying = underlying;
      this.width = width;
    }

    public Type underlying() {
      return underlying;
    }

    public int width() {
      return width;
    }

    @Override
    public BitFieldType withVolatile(boolean volatileQualified) {
      return new BitFieldType(underlying, width, volatileQualified);
    }

    @Override
    public String typeName() {
      return underlying.typeName() + " : " + width;
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof BitFieldType)) {
        return false;
      }
      BitFieldType other = (BitFieldType)o;
      return width == other.width && underlying.equals(other.underlying) &&
             isVolatile() == other.isVolatile();
    }

    @Override
    public int hashCode() {
      return 31 * underlying.hashCode() + width + (isVolatile() ? 1 : 0);
    }
  }

  public static class PointerType extends Type {
    private final Type target;

    public PointerType(Type target, boolean isVolatile) {
      super(isVolatile);
      this.target = target;
    }

    public Type target() {
      return target;
    }

    @Override
    public PointerType withVolatile(boolean volatileQualified) {
      return new PointerType(target, volatileQualified);
    }

    @Override
    public String typeName() {
      return target.toString() + " *";
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof PointerType)) {
        return false;
      }
      PointerType other = (PointerType)o;
      return target.equals(other.target) &&
             isVolatile() == other.isVolatile();
    }

    @Override
    public int hashCode() {
      return 37 * target.hashCode() + (isVolatile() ? 1 : 0);
    }
  }

  public static class ArrayType extends Type {
    private final Type elementType;
    private final long size;

    public ArrayType(Type elementType, long size, boolean isVolatile) {
      super(isVolatile);
      this.elementType = elementType;
      this.size = size;
    }

    public Type elementType() {
      return elementType;
    }

    public long size() {
      return size;
    }

    @Override
    public ArrayType withVolatile(boolean volatileQualified) {
      return new ArrayType(elementType, size, volatileQualified);
    }

    @Override
    public String typeName() {
      return elementType.toString() + "[" + size + "]";
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof ArrayType)) {
        return false;
      }
      ArrayType other = (ArrayType)o;
      return size == other.size && elementType.equals(other.elementType) &&
             isVolatile() == other.isVolatile();
    }

    @Override
    public int hashCode() {
      return 41 * elementType.hashCode() + (int)size + (isVolatile() ? 1 : 0);
    }
  }

  public static class StructType extends Type {
    public static class StructField {
      private final Type type;
      private final String name;

      public StructField(Type type, String name) {
        this.type = type;
        this.name = name;
      }

      public Type type() {
        return type;
      }

      public String name() {
        return name;
      }

      @Override
      public boolean equals(Object o) {
        if (!(o instanceof StructField)) {
          return false;
        }
        StructField other = (StructField)o;
        return name.equals(other.name) && type.equals(other.type);
      }

      @Override
      public int hashCode() {
        return name.hashCode() * 31 + type.hashCode();
      }

      @Override
      public String toString() {
        return type.toString() + " " + name;
      }
    }

    private final String tag;
    private final List<StructField> fields;

    public StructType(String tag, List<StructField> fields,
                      boolean isVolatile) {
      super(isVolatile);
      this.tag = tag;
      this.fields = Collections.unmodifiableList(
                            new ArrayList<StructField>(fields));
    }

    public String tag() {
      return tag;
    }

    public List<StructField> fields() {
      return fields;
    }

    /**
     * @param name
     * @return the type of the named field
     * @throws GotoCCRuntimeError if no such field
     */
    public Type fieldType(String name) {
      for (StructField f: fields) {
        if (f.name().equals(name)) {
          return f.type();
        }
      }
      throw new GotoCCRuntimeError("struct " + tag + " has no field " + name);
    }

    @Override
    public StructType withVolatile(boolean volatileQualified) {
      return new StructType(tag, fields, volatileQualified);
    }

    @Override
    public String typeName() {
      return "struct " + tag;
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof StructType)) {
        return false;
      }
      StructType other = (StructType)o;
      return tag.equals(other.tag) && fields.equals(other.fields) &&
             isVolatile() == other.isVolatile();
    }

    @Override
    public int hashCode() {
      return tag.hashCode() * 31 + fields.hashCode() + (isVolatile() ? 1 : 0);
    }
  }

  /**
   * The void type.  Also used as target of (void) casts.
   */
  public static class EmptyType extends Type {
    public EmptyType() {
      super(false);
    }

    @Override
    public EmptyType withVolatile(boolean volatileQualified) {
      return this;
    }

    @Override
    public String typeName() {
      return "void";
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof EmptyType;
    }

    @Override
    public int hashCode() {
      return 1;
    }
  }

  /**
   * Type of a function designator
   */
  public static class CodeType extends Type {
    private final Type returnType;
    private final List<Type> parameters;

    public CodeType(Type returnType, List<Type> parameters) {
      super(false);
      this.returnType = returnType;
      this.parameters = Collections.unmodifiableList(
                                      new ArrayList<Type>(parameters));
    }

    public Type returnType() {
      return returnType;
    }

    public List<Type> parameters() {
      return parameters;
    }

    @Override
    public CodeType withVolatile(boolean volatileQualified) {
      return this;
    }

    @Override
    public String typeName() {
      return returnType.toString() + " (" +
             StringUtils.join(parameters, ", ") + ")";
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof CodeType)) {
        return false;
      }
      CodeType other = (CodeType)o;
      return returnType.equals(other.returnType) &&
             parameters.equals(other.parameters);
    }

    @Override
    public int hashCode() {
      return returnType.hashCode() * 43 + parameters.hashCode();
    }
  }

  public static PointerType pointerTo(Type target) {
    return new PointerType(target, false);
  }

  public static ArrayType arrayOf(Type elementType, long size) {
    return new ArrayType(elementType, size, false);
  }

  public static StructType struct(String tag, List<StructType.StructField> fields) {
    return new StructType(tag, fields, false);
  }

  public static CodeType function(Type returnType, List<Type> parameters) {
    return new CodeType(returnType, parameters);
  }

  public static BitFieldType bitField(Type underlying, int width) {
    return new BitFieldType(underlying, width, false);
  }

  public static boolean isBool(Type t) {
    return t instanceof BoolType;
  }

  public static boolean isEmpty(Type t) {
    return t instanceof EmptyType;
  }

  public static boolean isPointer(Type t) {
    return t instanceof PointerType;
  }

  public static boolean isBitField(Type t) {
    return t instanceof BitFieldType;
  }

  public static boolean isCode(Type t) {
    return t instanceof CodeType;
  }

  /**
   * Type obtained by indexing into or dereferencing a value of type t
   * @param t array or pointer type
   * @return element or target type
   */
  public static Type elementType(Type t) {
    if (t instanceof ArrayType) {
      return ((ArrayType)t).elementType();
    } else if (t instanceof PointerType) {
      return ((PointerType)t).target();
    } else {
      throw new GotoCCRuntimeError("Expected array or pointer type: " + t);
    }
  }

  /**
   * Return type of a function designator, which may be a function pointer
   * @param t
   * @return
   */
  public static Type returnType(Type t) {
    if (t instanceof PointerType) {
      t = ((PointerType)t).target();
    }
    if (t instanceof CodeType) {
      return ((CodeType)t).returnType();
    }
    throw new GotoCCRuntimeError("Expected function type: " + t);
  }
}
